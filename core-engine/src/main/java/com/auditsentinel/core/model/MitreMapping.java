package com.auditsentinel.core.model;

import java.util.List;
import java.util.Objects;

/**
 * MITRE ATT&amp;CK classification attached to a finding.
 *
 * @since 1.0.0
 */
public final class MitreMapping {

    private final List<String> tactics;
    private final List<String> techniques;
    private final List<String> subTechniques;

    public MitreMapping(List<String> tactics, List<String> techniques, List<String> subTechniques) {
        this.tactics = List.copyOf(Objects.requireNonNull(tactics, "tactics must not be null"));
        this.techniques = List.copyOf(Objects.requireNonNull(techniques, "techniques must not be null"));
        this.subTechniques = List.copyOf(Objects.requireNonNull(subTechniques, "subTechniques must not be null"));
    }

    public List<String> getTactics() {
        return tactics;
    }

    public List<String> getTechniques() {
        return techniques;
    }

    public List<String> getSubTechniques() {
        return subTechniques;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MitreMapping that))
            return false;
        return tactics.equals(that.tactics)
                && techniques.equals(that.techniques)
                && subTechniques.equals(that.subTechniques);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tactics, techniques, subTechniques);
    }

    @Override
    public String toString() {
        return "MitreMapping{tactics=" + tactics + ", techniques=" + techniques
                + ", subTechniques=" + subTechniques + '}';
    }
}
