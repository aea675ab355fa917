package com.warmlead.crm.sync.search;

import com.warmlead.crm.sync.config.SearchProperties;
import com.warmlead.crm.sync.dto.SearchResponse;
import com.warmlead.crm.sync.entity.User;
import com.warmlead.crm.sync.pipedrive.PipedriveClient;
import com.warmlead.crm.sync.pipedrive.PipedriveClientFactory;
import com.warmlead.crm.sync.pipedrive.PipedrivePerson;
import com.warmlead.crm.sync.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Searches the user's Pipedrive persons by name or email.
 * 
 * Every whitespace-separated term is searched on its own and the results are merged,
 * keeping the first occurrence of each person. Results are cached per user and query.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PersonSearchService {

    private final UserRepository userRepository;
    private final PipedriveClientFactory clientFactory;
    private final SearchResultCache searchResultCache;
    private final SearchRateLimiter searchRateLimiter;
    private final SearchProperties searchProperties;

    public SearchResponse search(UUID userId, String query) {
        searchRateLimiter.acquire(userId);

        String trimmed = query != null ? query.trim() : "";
        if (trimmed.length() < searchProperties.getMinQueryLength()) {
            throw new IllegalArgumentException(
                "Search query must be at least " + searchProperties.getMinQueryLength() + " characters long");
        }

        String cacheKey = userId + ":" + trimmed.toLowerCase(Locale.ROOT);
        Optional<List<PipedrivePerson>> cached = searchResultCache.get(cacheKey);
        if (cached.isPresent()) {
            log.debug("Search cache hit for user {}", userId);
            return new SearchResponse(cached.get(), cached.get().size(), true);
        }

        User user = userRepository.findById(userId)
            .orElseThrow(() -> new IllegalArgumentException("User not found: " + userId));
        PipedriveClient client = clientFactory.create(user.getPipedriveApiKey());

        Map<Long, PipedrivePerson> merged = new LinkedHashMap<>();
        for (String term : trimmed.split("\\s+")) {
            for (PipedrivePerson person : client.searchPersons(term).orElseThrow()) {
                merged.putIfAbsent(person.id(), person);
            }
        }

        List<PipedrivePerson> results = new ArrayList<>(merged.values());
        searchResultCache.put(cacheKey, results);
        return new SearchResponse(results, results.size(), false);
    }
}
