package com.cinegraph.collab.model;

import lombok.Builder;
import lombok.Data;

/**
 * One upstream credit row: a person on a work in a given role.
 * Not persisted by this service.
 */
@Data
@Builder
public class Credit {

    public static final String PERFORMER = "performer";
    public static final String DIRECTOR = "director";

    /** Null in the feed marks a malformed credit */
    private Long personId;

    /** performer, director, or a crew role name such as "editor" */
    private String roleKind;

    /** Billing position, performers only. Lower = more prominent. */
    private Integer billingOrder;
}
