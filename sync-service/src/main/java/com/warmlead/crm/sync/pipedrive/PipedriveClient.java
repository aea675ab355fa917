package com.warmlead.crm.sync.pipedrive;

import com.warmlead.crm.common.remote.RemoteCallResult;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Pipedrive API operations used by the sync engine and person search.
 * 
 * Implementations return failed results tagged with an error kind instead of throwing
 * for HTTP and transport failures. One client instance is bound to one API token.
 */
public interface PipedriveClient {

    RemoteCallResult<PipedriveUser> testConnection();

    /**
     * Fetch one page of persons.
     *
     * @param since when not null, only persons updated at or after this UTC time are kept
     * @param start offset of the page
     * @param limit page size
     */
    RemoteCallResult<PersonPage> getPersonsPage(LocalDateTime since, int start, int limit);

    RemoteCallResult<List<PipedriveOrganization>> getOrganizations();

    RemoteCallResult<PipedriveOrganization> getOrganizationDetails(long organizationId);

    RemoteCallResult<List<PipedrivePerson>> searchPersons(String term);

    /**
     * Fetch every person page by page. Stops at the first failed page.
     */
    default RemoteCallResult<List<PipedrivePerson>> getPersons(LocalDateTime since, int pageSize) {
        List<PipedrivePerson> persons = new ArrayList<>();
        int start = 0;
        while (true) {
            RemoteCallResult<PersonPage> page = getPersonsPage(since, start, pageSize);
            if (!page.success()) {
                return RemoteCallResult.failure(page.errorKind(), page.error());
            }
            persons.addAll(page.data().persons());
            if (!page.data().hasMore()) {
                return RemoteCallResult.success(persons);
            }
            start = page.data().nextStart();
        }
    }
}
