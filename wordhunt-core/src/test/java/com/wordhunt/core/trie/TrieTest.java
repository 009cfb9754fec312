package com.wordhunt.core.trie;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class TrieTest {

    @Test
    void insertedWordsAreFoundAndPrefixesAreNotWords() {
        Trie trie = Trie.of("cat", "car", "cart");

        assertTrue(trie.contains("cat"));
        assertTrue(trie.contains("car"));
        assertTrue(trie.contains("cart"));
        assertFalse(trie.contains("ca"));
        assertFalse(trie.contains("cats"));
        assertTrue(trie.containsPrefix("ca"));
        assertTrue(trie.containsPrefix("cart"));
        assertFalse(trie.containsPrefix("co"));
        assertEquals(3, trie.size());
    }

    @Test
    void walkingChildrenEndsOnWordNode() {
        Trie trie = Trie.of(List.of("tag"));

        TrieNode node = trie.root();
        for (char letter : "tag".toCharArray()) {
            node = node.child(letter);
            assertNotNull(node);
        }
        assertTrue(node.isWord());
        assertFalse(node.hasChildren());
        assertFalse(trie.root().child('t').isWord());
        assertNull(trie.root().child('x'));
        assertNull(trie.root().child('T'));
    }

    @Test
    void insertIsIdempotent() {
        Trie trie = new Trie();

        assertTrue(trie.insert("bee"));
        int nodes = trie.nodeCount();
        assertFalse(trie.insert("bee"));

        assertEquals(1, trie.size());
        assertEquals(nodes, trie.nodeCount());
    }

    @Test
    void sharedPrefixesShareNodes() {
        Trie trie = Trie.of("cat", "car");
        assertEquals(5, trie.nodeCount());

        trie.insert("ca");
        assertEquals(5, trie.nodeCount());
        assertEquals(3, trie.size());
        assertTrue(trie.contains("ca"));
    }

    @Test
    void emptyTrieMatchesNothing() {
        Trie trie = new Trie();

        assertTrue(trie.isEmpty());
        assertFalse(trie.containsPrefix(""));
        assertFalse(trie.contains("a"));
        assertFalse(trie.root().hasChildren());
    }

    @Test
    void rejectsInvalidWords() {
        Trie trie = new Trie();

        assertThrows(InvalidDictionaryWordException.class, () -> trie.insert(""));
        assertThrows(InvalidDictionaryWordException.class, () -> trie.insert(null));
        assertThrows(InvalidDictionaryWordException.class, () -> trie.insert("Cat"));
        assertThrows(InvalidDictionaryWordException.class, () -> trie.insert("can't"));
        InvalidDictionaryWordException ex = assertThrows(InvalidDictionaryWordException.class,
                () -> trie.insert("é"));
        assertEquals("é", ex.getWord());
        assertTrue(trie.isEmpty());
    }
}
