package com.userstats.platform.service;

import com.userstats.platform.exception.StoreException;
import com.userstats.platform.model.ScanPage;
import com.userstats.platform.repository.InMemoryRedisRepository;
import com.userstats.platform.repository.RedisRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class KeyScannerTest {

    @Mock
    private RedisRepository redisRepository;

    private static List<String> collect(Iterable<String> keys) {
        List<String> result = new ArrayList<>();
        keys.forEach(result::add);
        return result;
    }

    @Test
    void testKeys_FollowsCursorUntilZero() {
        when(redisRepository.scan("0", "user:*", 2)).thenReturn(new ScanPage("17", List.of("user:1", "user:2")));
        when(redisRepository.scan("17", "user:*", 2)).thenReturn(new ScanPage("0", List.of("user:3")));

        List<String> keys = collect(new KeyScanner(redisRepository, 2).keys("user:*"));

        assertEquals(List.of("user:1", "user:2", "user:3"), keys);
        verify(redisRepository, times(2)).scan(anyString(), eq("user:*"), eq(2));
    }

    @Test
    void testKeys_EmptyPageWithLiveCursorKeepsGoing() {
        when(redisRepository.scan("0", "user:*", 50)).thenReturn(new ScanPage("9", List.of()));
        when(redisRepository.scan("9", "user:*", 50)).thenReturn(new ScanPage("0", List.of("user:8")));

        List<String> keys = collect(new KeyScanner(redisRepository, 50).keys("user:*"));

        assertEquals(List.of("user:8"), keys);
    }

    @Test
    void testKeys_IsLazy() {
        KeyScanner scanner = new KeyScanner(redisRepository, 50);

        Iterable<String> keys = scanner.keys("user:*");

        assertNotNull(keys);
        verifyNoInteractions(redisRepository);
    }

    @Test
    void testKeys_ResumesFromCursor() {
        when(redisRepository.scan("17", "user:*", 2)).thenReturn(new ScanPage("0", List.of("user:3")));

        KeyScanner.ScanIterator iterator =
            (KeyScanner.ScanIterator) new KeyScanner(redisRepository, 2).keys("user:*", "17").iterator();

        assertEquals("user:3", iterator.next());
        assertFalse(iterator.hasNext());
        assertTrue(iterator.isExhausted());
        assertEquals("0", iterator.getCursor());
        assertThrows(NoSuchElementException.class, iterator::next);
    }

    @Test
    void testKeys_ExposesCursorOfNextPage() {
        when(redisRepository.scan("0", "user:*", 2)).thenReturn(new ScanPage("17", List.of("user:1", "user:2")));

        KeyScanner.ScanIterator iterator =
            (KeyScanner.ScanIterator) new KeyScanner(redisRepository, 2).keys("user:*").iterator();
        iterator.next();

        assertEquals("17", iterator.getCursor());
        assertFalse(iterator.isExhausted());
    }

    @Test
    void testKeys_StoreFailureSurfacesFromIterator() {
        when(redisRepository.scan("0", "user:*", 50)).thenThrow(new StoreException("Connection refused"));

        Iterator<String> iterator = new KeyScanner(redisRepository, 50).keys("user:*").iterator();

        assertThrows(StoreException.class, iterator::hasNext);
    }

    @Test
    void testKeys_EachIteratorStartsAFreshPass() {
        InMemoryRedisRepository store = new InMemoryRedisRepository();
        for (int i = 1; i <= 5; i++) {
            store.putHash("user:" + i, Map.of("last_name", "N" + i));
        }
        store.putScore("board:2", "1", 10);
        KeyScanner scanner = new KeyScanner(store, 2);
        Iterable<String> keys = scanner.keys("user:*");

        List<String> first = collect(keys);
        List<String> second = collect(keys);

        assertEquals(List.of("user:1", "user:2", "user:3", "user:4", "user:5"), first);
        assertEquals(first, second);
        assertEquals(6, store.getScanCalls());
    }

    @Test
    void testConstructor_RejectsNonPositivePageSize() {
        assertThrows(IllegalArgumentException.class, () -> new KeyScanner(redisRepository, 0));
    }
}
