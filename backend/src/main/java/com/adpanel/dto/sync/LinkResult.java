package com.adpanel.dto.sync;

import lombok.Data;

@Data
public class LinkResult {
    private int linked;
    private int withoutPost;
    /** Content rows created from the on-demand detail fetch */
    private int contentCreated;
    /** Post ids still without content after the detail fetch */
    private int unresolved;
    private int failed;
}
