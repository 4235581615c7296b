/*
 * Copyright (c) 2023-2025 Umit Unal
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.umitunal.bitcask.radix;

import java.util.ArrayList;
import java.util.List;

/**
 * Space-optimized trie (radix tree) over strings.
 *
 * <p>Every node that would be the only child of a non-terminal parent is merged into
 * that parent, so chains of single-child nodes never appear below the root. The root
 * always keeps an empty prefix; storing the empty string marks the root terminal.</p>
 *
 * <p>This class is not thread-safe. Callers that share a tree between threads must
 * guard mutations with their own lock; concurrent lookups without a concurrent
 * mutation are safe.</p>
 */
public class RadixTree {

    private final RadixNode root = new RadixNode("", false);

    /**
     * Inserts a word. Inserting a word that is already stored has no effect.
     *
     * @param word the word, may be empty
     */
    public void insert(String word) {
        requireWord(word);
        root.insert(word);
    }

    /**
     * @param word the word to look up
     * @return true if the word was inserted and not deleted since
     */
    public boolean find(String word) {
        requireWord(word);
        if (word.isEmpty()) {
            return root.isTerminal();
        }
        return root.find(word);
    }

    /**
     * Deletes a word, merging nodes that are left with a single child.
     *
     * @param word the word to delete
     * @return true if the word was stored and has been removed
     */
    public boolean delete(String word) {
        requireWord(word);
        if (word.isEmpty()) {
            boolean wasStored = root.isTerminal();
            root.setTerminal(false);
            return wasStored;
        }
        return root.delete(word, true);
    }

    /**
     * Matches a word against the prefix of the root node.
     *
     * @param word the word to match
     * @return the common prefix, remaining root prefix and remaining word
     */
    public MatchResult match(String word) {
        requireWord(word);
        return root.match(word);
    }

    /**
     * @return every stored word, in no particular order
     */
    public List<String> words() {
        List<String> words = new ArrayList<>();
        root.collect("", words);
        return words;
    }

    /**
     * @return the number of stored words
     */
    public int size() {
        return words().size();
    }

    public boolean isEmpty() {
        return !root.isTerminal() && root.getChildren().isEmpty();
    }

    RadixNode getRoot() {
        return root;
    }

    /**
     * Renders the tree one node per line, indented by depth, terminal nodes tagged with {@code (leaf)}.
     */
    @Override
    public String toString() {
        StringBuilder out = new StringBuilder();
        root.print(out, 0);
        return out.toString();
    }

    private static void requireWord(String word) {
        if (word == null) {
            throw new IllegalArgumentException("word cannot be null");
        }
    }
}
