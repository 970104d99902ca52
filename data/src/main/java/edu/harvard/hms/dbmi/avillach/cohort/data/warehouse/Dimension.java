package edu.harvard.hms.dbmi.avillach.cohort.data.warehouse;

import java.util.ArrayList;
import java.util.List;

/**
 * Auxiliary relations joined onto {@link Relation#FACT} to describe a fact row. Diagnoses, procedures and materials are reached
 * through a bridge relation keyed by the group key, the others are keyed directly.
 */
public enum Dimension {

    DIAGNOSIS(Relation.B_DIAGNOSIS, Relation.FD_DIAGNOSIS, "DIAGNOSIS"),
    PROCEDURE(Relation.B_PROCEDURE, Relation.FD_PROCEDURE, "PROCEDURE"),
    MATERIAL(Relation.B_MATERIAL, Relation.FD_MATERIAL, "MATERIAL"),
    UNIT_OF_MEASURE(Relation.D_UNIT_OF_MEASURE, "UOM_KEY"),
    ENCOUNTER(Relation.D_ENCOUNTER, "ENCOUNTER_KEY"),
    METADATA(Relation.D_METADATA, "META_DATA_KEY");

    private final Relation bridge;
    private final Relation target;
    private final String groupKey;
    private final String key;

    Dimension(Relation bridge, Relation target, String prefix) {
        this.bridge = bridge;
        this.target = target;
        this.groupKey = prefix + "_GROUP_KEY";
        this.key = prefix + "_KEY";
    }

    Dimension(Relation target, String key) {
        this.bridge = null;
        this.target = target;
        this.groupKey = null;
        this.key = key;
    }

    public Relation getTarget() {
        return target;
    }

    public List<Join> joins(JoinType type) {
        List<Join> joins = new ArrayList<>();
        if (bridge != null) {
            joins.add(new Join(bridge, Relation.FACT.column(groupKey), bridge.column(groupKey), type));
            joins.add(new Join(target, bridge.column(key), target.column(key), type));
        } else {
            joins.add(new Join(target, Relation.FACT.column(key), target.column(key), type));
        }
        return joins;
    }
}
