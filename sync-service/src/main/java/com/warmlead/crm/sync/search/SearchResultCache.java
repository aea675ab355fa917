package com.warmlead.crm.sync.search;

import com.warmlead.crm.sync.pipedrive.PipedrivePerson;

import java.util.List;
import java.util.Optional;

/**
 * Short-lived cache of person search results, keyed by user and normalized query.
 * 
 * Not a source of truth: entries may disappear at any time.
 */
public interface SearchResultCache {

    Optional<List<PipedrivePerson>> get(String key);

    void put(String key, List<PipedrivePerson> results);

    void clear();

    int size();
}
