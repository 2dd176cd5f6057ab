package com.poultry.review.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueFilter {

    private String region;
    private String district;
    private String constituency;
    private String assignedTo;
    private ApplicationKind kind;
    private boolean escalatedOnly;

    public static QueueFilter none() {
        return new QueueFilter();
    }

    public boolean matches(QueueEntry entry) {
        if (region != null && !region.equalsIgnoreCase(entry.getRegion())) return false;
        if (district != null && !district.equalsIgnoreCase(entry.getDistrict())) return false;
        if (constituency != null && !constituency.equalsIgnoreCase(entry.getConstituency())) return false;
        if (assignedTo != null && !assignedTo.equals(entry.getAssignedTo())) return false;
        if (kind != null && kind != entry.getKind()) return false;
        return !escalatedOnly || entry.isEscalated();
    }
}
