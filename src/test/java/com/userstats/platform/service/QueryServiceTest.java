package com.userstats.platform.service;

import com.userstats.platform.exception.StoreException;
import com.userstats.platform.model.FilteredUser;
import com.userstats.platform.model.GeoLocation;
import com.userstats.platform.model.IndexCapability;
import com.userstats.platform.model.ParityNames;
import com.userstats.platform.model.Parity;
import com.userstats.platform.model.QueryOutcome;
import com.userstats.platform.model.ScanPage;
import com.userstats.platform.model.UserProfile;
import com.userstats.platform.parser.UserRecordMapper;
import com.userstats.platform.repository.InMemoryRedisRepository;
import com.userstats.platform.repository.InMemorySearchIndexRepository;
import com.userstats.platform.repository.RedisRepository;
import com.userstats.platform.repository.SearchIndexRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class QueryServiceTest {

    private InMemoryRedisRepository store;
    private InMemorySearchIndexRepository index;

    @BeforeEach
    void setUp() {
        store = new InMemoryRedisRepository();
        index = new InMemorySearchIndexRepository(store, IndexCapability.AVAILABLE);
    }

    private QueryService service(IndexCapability capability) {
        return new QueryService(store, index, capability, new KeyScanner(store, 2));
    }

    private void putUser(String id, String lastName, String email, String gender, String country, String latitude) {
        Map<String, String> fields = new HashMap<>();
        fields.put("first_name", "F" + id);
        fields.put("last_name", lastName);
        fields.put("email", email);
        fields.put("gender", gender);
        fields.put("country", country);
        fields.put("longitude", "100.5");
        fields.put("latitude", latitude);
        store.putHash("user:" + id, fields);
    }

    private void loadDemographicFixture() {
        putUser("1", "Ivanova", "a@example.com", "female", "Russia", "44.1");
        putUser("2", "Li", "b@example.com", "female", "China", "40");
        putUser("3", "Petrov", "c@example.com", "male", "Russia", "42.0");
        putUser("4", "Wang", "d@example.com", "female", "China", "46");
        putUser("5", "Sato", "e@example.com", "female", "Japan", "43.0");
        putUser("6", "Zhao", "f@example.com", "female", "China", "39.9");
        putUser("7", "Orlova", "g@example.com", "female", "Russia", "not-a-number");
        putUser("8", "Chen", "h@example.com", "female", "China", "45.99");
        store.putHash("user:9", Map.of("gender", "female", "country", "China"));
        // 22 tokens: last_login falls back to token 21, the "last_login:" label
        UserProfile shortLine = UserRecordMapper.mapLine("10 first_name: Mei last_name: Lin email: mei@example.com "
            + "gender: female ip_address: 10.0.0.7 country: China country_code: CN city: Harbin "
            + "longitude: 126.6 latitude: 42.5 last_login:").orElseThrow();
        store.putHash(shortLine.key(), shortLine.toFields());
        putUser("11", "Suffixed", "k@example.com", "female", "China", "42d");
        putUser("12", "Hex", "l@example.com", "female", "Russia", "0x2Ap0");
    }

    private static final Set<String> DEMOGRAPHIC_MATCHES = Set.of("user:1", "user:2", "user:4", "user:8", "user:10");

    private static Set<String> ids(List<FilteredUser> users) {
        return users.stream().map(FilteredUser::getId).collect(Collectors.toSet());
    }

    @Test
    void testProfileById_ReturnsAllFields() {
        putUser("3", "Petrov", "c@example.com", "male", "Russia", "42.0");

        QueryOutcome<Map<String, String>> outcome = service(IndexCapability.UNAVAILABLE).profileById("3");

        assertEquals(QueryOutcome.Status.FOUND, outcome.getStatus());
        assertEquals("Petrov", outcome.getValue().get("last_name"));
        assertEquals(7, outcome.getValue().size());
    }

    @Test
    void testProfileById_MissingAndFailedBothEmpty() {
        QueryService queryService = service(IndexCapability.UNAVAILABLE);

        QueryOutcome<Map<String, String>> missing = queryService.profileById("404");
        store.setFailReads(true);
        QueryOutcome<Map<String, String>> failed = queryService.profileById("404");

        assertTrue(missing.getValue().isEmpty());
        assertEquals(QueryOutcome.Status.EMPTY, missing.getStatus());
        assertTrue(failed.getValue().isEmpty());
        assertTrue(failed.isFailed());
        assertInstanceOf(StoreException.class, failed.getFailure());
    }

    @Test
    void testLocationById_BothCoordinates() {
        store.putHash("user:1", Map.of("longitude", "116.4", "latitude", "39.9"));

        Optional<GeoLocation> location = service(IndexCapability.UNAVAILABLE).locationById("1").getValue();

        assertEquals(Optional.of(new GeoLocation("116.4", "39.9")), location);
    }

    @Test
    void testLocationById_HalfPopulatedProfileIsEmpty() {
        store.putHash("user:1", Map.of("longitude", "116.4"));
        store.putHash("user:2", Map.of("latitude", "39.9", "longitude", ""));

        QueryService queryService = service(IndexCapability.UNAVAILABLE);

        assertEquals(Optional.empty(), queryService.locationById("1").getValue());
        assertEquals(Optional.empty(), queryService.locationById("2").getValue());
        assertEquals(Optional.empty(), queryService.locationById("3").getValue());
    }

    @Test
    void testLocationById_StoreErrorIsEmpty() {
        store.setFailReads(true);

        QueryOutcome<Optional<GeoLocation>> outcome = service(IndexCapability.UNAVAILABLE).locationById("1");

        assertTrue(outcome.isFailed());
        assertEquals(Optional.empty(), outcome.getValue());
    }

    @Test
    void testParityFilteredNames_OddAndEven() {
        store.putHash("user:1", Map.of("last_name", "One"));
        store.putHash("user:2", Map.of("last_name", "Two"));
        store.putHash("user:3", Map.of("last_name", "Three"));
        QueryService queryService = service(IndexCapability.UNAVAILABLE);

        ParityNames odd = queryService.parityFilteredNames(Parity.ODD).getValue();
        ParityNames even = queryService.parityFilteredNames(Parity.EVEN).getValue();

        assertEquals(List.of("user:1", "user:3"), odd.getKeys());
        assertEquals(List.of("One", "Three"), odd.getLastNames());
        assertEquals(List.of("user:2"), even.getKeys());
        assertEquals(List.of("Two"), even.getLastNames());
    }

    @Test
    void testParityFilteredNames_LeadingDigitOnlyAndLastNameRequired() {
        store.putHash("user:21", Map.of("last_name", "TwentyOne"));
        store.putHash("user:30", Map.of("last_name", ""));
        store.putHash("user:47", Map.of("first_name", "NoLast"));
        store.putHash("user:x5", Map.of("last_name", "NotNumeric"));
        store.putHash("user:", Map.of("last_name", "NoId"));
        store.putHash("user:68", Map.of("last_name", "SixtyEight"));
        QueryService queryService = service(IndexCapability.UNAVAILABLE);

        ParityNames even = queryService.parityFilteredNames(Parity.EVEN).getValue();
        ParityNames odd = queryService.parityFilteredNames(Parity.ODD).getValue();

        assertEquals(List.of("user:21", "user:68"), even.getKeys());
        assertEquals(List.of("TwentyOne", "SixtyEight"), even.getLastNames());
        assertTrue(odd.isEmpty());
    }

    @Test
    void testParityFilteredNames_DuplicateScanKeysVisitedOnce() {
        RedisRepository repository = mock(RedisRepository.class);
        when(repository.scan("0", "user:*", 50)).thenReturn(new ScanPage("5", List.of("user:1", "user:3")));
        when(repository.scan("5", "user:*", 50)).thenReturn(new ScanPage("0", List.of("user:3", "user:5")));
        when(repository.getField(anyString(), eq("last_name"))).thenReturn("Name");
        QueryService queryService = new QueryService(repository, mock(SearchIndexRepository.class),
            IndexCapability.UNAVAILABLE, new KeyScanner(repository, 50));

        ParityNames odd = queryService.parityFilteredNames(Parity.ODD).getValue();

        assertEquals(List.of("user:1", "user:3", "user:5"), odd.getKeys());
        verify(repository, times(1)).getField("user:3", "last_name");
    }

    @Test
    void testParityFilteredNames_ScanFailureGivesEmptyParallelLists() {
        store.putHash("user:1", Map.of("last_name", "One"));
        store.setFailReads(true);

        QueryOutcome<ParityNames> outcome = service(IndexCapability.UNAVAILABLE).parityFilteredNames(Parity.ODD);

        assertTrue(outcome.isFailed());
        assertTrue(outcome.getValue().getKeys().isEmpty());
        assertTrue(outcome.getValue().getLastNames().isEmpty());
    }

    @Test
    void testCompoundFilter_ScanFallback() {
        loadDemographicFixture();

        QueryService queryService = service(IndexCapability.UNAVAILABLE);
        List<FilteredUser> users = queryService.compoundFilter().getValue();

        assertEquals(QueryService.FilterPath.SCAN, queryService.filterPath());
        assertEquals(DEMOGRAPHIC_MATCHES, ids(users));
        assertEquals(0, index.getSearches());
        FilteredUser first = users.get(0);
        assertEquals("user:1", first.getId());
        assertEquals("F1", first.getFirstName());
        assertEquals("Ivanova", first.getLastName());
        assertEquals("Russia", first.getCountry());
        assertEquals("44.1", first.getLatitude());
        assertEquals("a@example.com", first.getEmail());
    }

    @Test
    void testCompoundFilter_IndexAndScanPathsAgree() {
        loadDemographicFixture();
        index.build();

        QueryService indexed = service(IndexCapability.AVAILABLE);
        QueryService scanned = service(IndexCapability.UNAVAILABLE);
        List<FilteredUser> viaIndex = indexed.compoundFilter().getValue();
        List<FilteredUser> viaScan = scanned.compoundFilter().getValue();

        assertEquals(QueryService.FilterPath.INDEX, indexed.filterPath());
        assertEquals(1, index.getSearches());
        assertEquals(ids(viaScan), ids(viaIndex));
        assertEquals(Set.copyOf(viaScan), Set.copyOf(viaIndex));
        assertTrue(ids(viaIndex).contains("user:10"));
    }

    @Test
    void testCompoundFilter_RebuildingIndexLeavesResultsUnchanged() {
        loadDemographicFixture();
        QueryService queryService = service(IndexCapability.AVAILABLE);

        index.build();
        Set<String> first = ids(queryService.compoundFilter().getValue());
        index.build();
        Set<String> second = ids(queryService.compoundFilter().getValue());

        assertEquals(1, index.getBuilds());
        assertEquals(first, second);
        assertEquals(DEMOGRAPHIC_MATCHES, second);
    }

    @Test
    void testCompoundFilter_MissingIndexFallsBackToScan() {
        loadDemographicFixture();

        // Capability says yes but the index was never built
        QueryOutcome<List<FilteredUser>> outcome = service(IndexCapability.AVAILABLE).compoundFilter();

        assertEquals(QueryOutcome.Status.FOUND, outcome.getStatus());
        assertEquals(DEMOGRAPHIC_MATCHES, ids(outcome.getValue()));
        assertEquals(0, index.getSearches());
    }

    @Test
    void testCompoundFilter_IndexAndScanBothFailingIsEmpty() {
        loadDemographicFixture();
        store.setFailReads(true);

        QueryOutcome<List<FilteredUser>> outcome = service(IndexCapability.AVAILABLE).compoundFilter();

        assertTrue(outcome.isFailed());
        assertTrue(outcome.getValue().isEmpty());
    }

    @Test
    void testCompoundFilter_NoMatchesIsEmptyNotFailed() {
        putUser("1", "Petrov", "c@example.com", "male", "Russia", "42.0");

        QueryOutcome<List<FilteredUser>> outcome = service(IndexCapability.UNAVAILABLE).compoundFilter();

        assertEquals(QueryOutcome.Status.EMPTY, outcome.getStatus());
    }

    @Test
    void testLeaderboardEmails_DescendingScoreOrder() {
        putUser("u1", "A", "u1@example.com", "female", "China", "41");
        putUser("u2", "B", "u2@example.com", "female", "China", "41");
        putUser("u3", "C", "u3@example.com", "female", "China", "41");
        store.putScore("board:2", "u1", 10);
        store.putScore("board:2", "u2", 20);
        store.putScore("board:2", "u3", 15);

        List<String> emails = service(IndexCapability.UNAVAILABLE).leaderboardEmails().getValue();

        assertEquals(List.of("u2@example.com", "u3@example.com", "u1@example.com"), emails);
    }

    @Test
    void testLeaderboardEmails_MissingEmailOmittedWithoutReordering() {
        putUser("u1", "A", "u1@example.com", "female", "China", "41");
        putUser("u3", "C", "", "female", "China", "41");
        putUser("u4", "D", "u4@example.com", "female", "China", "41");
        store.putScore("board:2", "u1", 10);
        store.putScore("board:2", "u2", 20);
        store.putScore("board:2", "u3", 15);
        store.putScore("board:2", "u4", 12);

        List<String> emails = service(IndexCapability.UNAVAILABLE).leaderboardEmails().getValue();

        assertEquals(List.of("u4@example.com", "u1@example.com"), emails);
    }

    @Test
    void testLeaderboardEmails_OnlyTopTenConsidered() {
        for (int i = 1; i <= 12; i++) {
            putUser("p" + i, "L" + i, "p" + i + "@example.com", "female", "China", "41");
            store.putScore("board:2", "p" + i, i);
        }
        store.putScore("board:1", "p1", 1000);

        List<String> emails = service(IndexCapability.UNAVAILABLE).leaderboardEmails().getValue();

        assertEquals(10, emails.size());
        assertEquals("p12@example.com", emails.get(0));
        assertEquals("p3@example.com", emails.get(9));
    }

    @Test
    void testLeaderboardEmails_UnknownBoardAndStoreFailure() {
        QueryService queryService = service(IndexCapability.UNAVAILABLE);

        QueryOutcome<List<String>> unknown = queryService.leaderboardEmails("99", 10);
        store.setFailReads(true);
        QueryOutcome<List<String>> failed = queryService.leaderboardEmails();

        assertEquals(QueryOutcome.Status.EMPTY, unknown.getStatus());
        assertTrue(failed.isFailed());
        assertTrue(failed.getValue().isEmpty());
    }

    @Test
    void testIdOf_TakesTextAfterFirstColon() {
        assertEquals("12", QueryService.idOf("user:12"));
        assertEquals("", QueryService.idOf("user:"));
        assertEquals("a:b", QueryService.idOf("user:a:b"));
    }
}
