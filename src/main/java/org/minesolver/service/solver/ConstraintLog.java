package org.minesolver.service.solver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Liste des égalités recueillies pour un plateau, en ajout seul. Rien n'est
 * retiré ni fusionné : la mémoire croît avec le nombre de cases révélées
 * pendant toute la partie.
 */
public class ConstraintLog {

    private final List<LinearConstraint> entries = new ArrayList<>();

    public void append(LinearConstraint constraint) {
        entries.add(constraint);
    }

    /** Nombre de contraintes ajoutées, sert aussi de numéro de version. */
    public int size() {
        return entries.size();
    }

    public LinearConstraint get(int index) {
        return entries.get(index);
    }

    public List<LinearConstraint> entries() {
        return Collections.unmodifiableList(entries);
    }
}
