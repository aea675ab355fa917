package com.warmlead.crm.sync.pipedrive;

import java.util.List;

/**
 * One page of persons.
 *
 * @param persons   persons on this page, after any incremental filtering
 * @param start     offset this page was requested at
 * @param fetched   number of persons the API returned before filtering
 * @param nextStart offset of the next page, or null when this is the last one
 */
public record PersonPage(List<PipedrivePerson> persons, int start, int fetched, Integer nextStart) {

    public boolean hasMore() {
        return nextStart != null;
    }
}
