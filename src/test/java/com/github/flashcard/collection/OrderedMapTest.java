package com.github.flashcard.collection;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class OrderedMapTest {

    private OrderedMap<String, Integer> map;

    @BeforeEach
    void setUp() {
        map = new OrderedMap<>();
    }

    private static <K, V> List<K> traverse(OrderedMap<K, V> map) {
        List<K> keys = new ArrayList<>();
        for (Pair<K, V> pair = map.oldest(); pair != null; pair = map.next(pair)) {
            keys.add(pair.getKey());
        }
        return keys;
    }

    // ========== 基础功能测试 ==========

    @Test
    @DisplayName("空映射：get返回null，oldest/newest为null")
    void testEmpty() {
        assertNull(map.get("a"));
        assertFalse(map.containsKey("a"));
        assertNull(map.oldest());
        assertNull(map.newest());
        assertTrue(map.isEmpty());
        assertEquals(List.of(), traverse(map));
    }

    @Test
    @DisplayName("a,b,c 插入 -> 删除b -> 重新插入b")
    void testInsertDeleteReinsertScenario() {
        map.set("a", 1);
        map.set("b", 2);
        map.set("c", 3);
        assertEquals(List.of("a", "b", "c"), traverse(map));

        assertEquals(2, map.delete("b"));
        assertEquals(List.of("a", "c"), traverse(map));

        assertNull(map.set("b", 20), "重新插入应视为新键");
        assertEquals(List.of("a", "c", "b"), traverse(map));
        assertEquals(20, map.get("b"));
        assertTrue(map.containsKey("b"));
    }

    @Test
    @DisplayName("更新已有键：返回旧值，位置不变")
    void testUpdateKeepsPosition() {
        map.set("a", 1);
        map.set("b", 2);
        map.set("c", 3);

        assertEquals(2, map.set("b", 22));
        assertEquals(22, map.get("b"));
        assertEquals(List.of("a", "b", "c"), traverse(map));
        assertEquals(3, map.size());
    }

    @Test
    @DisplayName("删除不存在的键：返回null，遍历结果不变")
    void testDeleteAbsentIsNoOp() {
        map.set("a", 1);
        map.set("b", 2);
        List<String> before = traverse(map);

        assertNull(map.delete("zzz"));
        assertEquals(before, traverse(map));
        assertEquals(2, map.size());
    }

    @Test
    @DisplayName("delete后get返回null，遍历不再出现该键")
    void testDeleteThenGet() {
        map.set("a", 1);
        map.set("b", 2);
        map.delete("a");

        assertNull(map.get("a"));
        assertFalse(traverse(map).contains("a"));
        assertEquals("b", map.oldest().getKey());
        assertEquals("b", map.newest().getKey());
    }

    @Test
    @DisplayName("oldest/newest 与 Pair.next/prev")
    void testOldestNewestAndNeighbours() {
        map.set("a", 1);
        map.set("b", 2);
        map.set("c", 3);

        Pair<String, Integer> oldest = map.oldest();
        Pair<String, Integer> newest = map.newest();
        assertEquals("a", oldest.getKey());
        assertEquals("c", newest.getKey());
        assertNull(newest.next());
        assertNull(oldest.prev());
        assertEquals("b", newest.prev().getKey());
        assertSame(map.getPair("b"), oldest.next());
    }

    @Test
    @DisplayName("被删除的Pair不再有后继")
    void testDeletedPairIsDetached() {
        map.set("a", 1);
        map.set("b", 2);
        Pair<String, Integer> a = map.oldest();

        map.delete("a");
        assertNull(a.next());
        assertEquals(1, a.getValue(), "已删除Pair保留最后的值");
    }

    @Test
    @DisplayName("遍历中先前进再删除当前键，未访问的键仍能访问到")
    void testDeleteWhileTraversing() {
        for (String k : new String[]{"a", "b", "c", "d"}) {
            map.set(k, 0);
        }
        List<String> visited = new ArrayList<>();
        Pair<String, Integer> pair = map.oldest();
        while (pair != null) {
            Pair<String, Integer> next = pair.next();
            visited.add(pair.getKey());
            if (pair.getKey().equals("b")) {
                map.delete("b");
            }
            pair = next;
        }
        assertEquals(List.of("a", "b", "c", "d"), visited);
        assertEquals(List.of("a", "c", "d"), traverse(map));
    }

    @Test
    @DisplayName("null 键或值被拒绝")
    void testNullRejected() {
        assertThrows(NullPointerException.class, () -> map.set(null, 1));
        assertThrows(NullPointerException.class, () -> map.set("a", null));
        assertTrue(map.isEmpty());
    }

    @Test
    @DisplayName("keys/iterator/toString 按插入顺序")
    void testViews() {
        map.set("x", 1);
        map.set("y", 2);
        assertEquals(List.of("x", "y"), map.keys());

        List<String> fromIterator = new ArrayList<>();
        for (Pair<String, Integer> pair : map) {
            fromIterator.add(pair.getKey());
        }
        assertEquals(List.of("x", "y"), fromIterator);
        assertEquals("{x=1, y=2}", map.toString());
    }

    // ========== 随机操作一致性测试 ==========

    @ParameterizedTest
    @ValueSource(longs = {1L, 42L, 2024L, 987654321L})
    @DisplayName("随机 set/delete 序列：每一步哈希视图与遍历视图一致，且顺序与LinkedHashMap相同")
    void testRandomOperationsStayConsistent(long seed) {
        Random random = new Random(seed);
        OrderedMap<Integer, Integer> ordered = new OrderedMap<>();
        // LinkedHashMap 的插入顺序模式同样是"更新不移动，删除后重插到尾部"
        Map<Integer, Integer> reference = new LinkedHashMap<>();

        for (int step = 0; step < 2000; step++) {
            int key = random.nextInt(64);
            if (random.nextInt(3) == 0) {
                assertEquals(reference.remove(key), ordered.delete(key), "delete返回值不一致, step=" + step);
            } else {
                int value = random.nextInt();
                assertEquals(reference.put(key, value), ordered.set(key, value), "set返回值不一致, step=" + step);
            }

            List<Integer> traversed = traverse(ordered);
            assertEquals(new ArrayList<>(reference.keySet()), traversed, "顺序不一致, step=" + step);
            assertEquals(reference.size(), ordered.size());
            for (Integer k : traversed) {
                assertEquals(reference.get(k), ordered.get(k));
            }
        }
    }
}
