package com.eainde.dealflow.matching;

import com.eainde.dealflow.model.StaffingAssignment;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Assignments of a deal after auto-assignment: the untouched manual ones and
 * the automatic ones that replace every earlier automatic pick.
 */
public record StaffingPlan(List<StaffingAssignment> manual, List<StaffingAssignment> automatic)
        implements Serializable {

    public StaffingPlan {
        manual = List.copyOf(manual);
        automatic = List.copyOf(automatic);
    }

    public List<StaffingAssignment> all() {
        List<StaffingAssignment> all = new ArrayList<>(manual);
        all.addAll(automatic);
        return List.copyOf(all);
    }
}
