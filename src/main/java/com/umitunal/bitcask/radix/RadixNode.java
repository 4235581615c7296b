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

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A node of a {@link RadixTree}.
 *
 * <p>Each node owns a prefix, a terminal flag telling whether the path from the root up to
 * and including this node spells a stored word, and its children keyed by the first character
 * of their prefix. Nodes strictly own their children; all structural changes are made by the
 * parent while it descends, so no back references are kept.</p>
 */
final class RadixNode {

    private String prefix;
    private boolean terminal;
    private Map<Character, RadixNode> children;

    RadixNode(String prefix, boolean terminal) {
        this.prefix = prefix;
        this.terminal = terminal;
        this.children = new HashMap<>();
    }

    String getPrefix() {
        return prefix;
    }

    boolean isTerminal() {
        return terminal;
    }

    void setTerminal(boolean terminal) {
        this.terminal = terminal;
    }

    Map<Character, RadixNode> getChildren() {
        return Collections.unmodifiableMap(children);
    }

    /**
     * Computes the common part of this node's prefix and a word.
     *
     * <pre>
     * new RadixNode("myprefix", false).match("mystring") = ("my", "prefix", "string")
     * </pre>
     *
     * @param word the word to compare
     * @return the common prefix, the remaining prefix and the remaining word
     */
    MatchResult match(String word) {
        int max = Math.min(prefix.length(), word.length());
        int x = 0;
        while (x < max && prefix.charAt(x) == word.charAt(x)) {
            x++;
        }
        return new MatchResult(prefix.substring(0, x), prefix.substring(x), word.substring(x));
    }

    /**
     * Inserts a word below this node. The word is relative to this node,
     * i.e. this node's own prefix has already been consumed.
     *
     * @param word the remaining word
     */
    void insert(String word) {
        if (word.isEmpty()) {
            terminal = true;
            return;
        }

        char first = word.charAt(0);
        RadixNode child = children.get(first);

        // No edge shares the first character: hang the whole word off this node
        if (child == null) {
            children.put(first, new RadixNode(word, true));
            return;
        }

        MatchResult match = child.match(word);

        // The child's prefix is fully consumed, keep descending
        if (match.remainingPrefix().isEmpty()) {
            child.insert(match.remainingWord());
            return;
        }

        // Split the child: the common part becomes an intermediate node
        RadixNode intermediate = new RadixNode(match.common(), false);
        child.prefix = match.remainingPrefix();
        intermediate.children.put(child.prefix.charAt(0), child);
        children.put(first, intermediate);

        if (match.remainingWord().isEmpty()) {
            intermediate.terminal = true;
        } else {
            intermediate.insert(match.remainingWord());
        }
    }

    /**
     * @param word a non-empty word relative to this node
     * @return true if the word is stored below this node
     */
    boolean find(String word) {
        RadixNode child = children.get(word.charAt(0));
        if (child == null) {
            return false;
        }

        MatchResult match = child.match(word);
        if (!match.remainingPrefix().isEmpty()) {
            return false;
        }
        if (match.remainingWord().isEmpty()) {
            return child.terminal;
        }
        return child.find(match.remainingWord());
    }

    /**
     * Deletes a non-empty word stored below this node and restores the
     * space-optimized shape on the way.
     *
     * @param word a non-empty word relative to this node
     * @param root whether this node is the tree root; the root never absorbs a child
     * @return true if the word was found and deleted
     */
    boolean delete(String word, boolean root) {
        char first = word.charAt(0);
        RadixNode child = children.get(first);
        if (child == null) {
            return false;
        }

        MatchResult match = child.match(word);
        if (!match.remainingPrefix().isEmpty()) {
            return false;
        }
        if (!match.remainingWord().isEmpty()) {
            return child.delete(match.remainingWord(), false);
        }
        if (!child.terminal) {
            return false;
        }

        if (child.children.isEmpty()) {
            children.remove(first);
            if (!root && !terminal && children.size() == 1) {
                absorbOnlyChild();
            }
        } else if (child.children.size() > 1) {
            child.terminal = false;
        } else {
            child.absorbOnlyChild();
        }
        return true;
    }

    /**
     * Merges the single child of this node into it. The combined node takes the
     * child's terminal flag and children.
     */
    private void absorbOnlyChild() {
        RadixNode only = children.values().iterator().next();
        prefix = prefix + only.prefix;
        terminal = only.terminal;
        children = only.children;
    }

    /**
     * Collects every stored word below this node.
     *
     * @param path the concatenated prefixes of the ancestors, excluding this node
     * @param out where the words are added
     */
    void collect(String path, List<String> out) {
        String here = path + prefix;
        if (terminal) {
            out.add(here);
        }
        for (RadixNode child : children.values()) {
            child.collect(here, out);
        }
    }

    void print(StringBuilder out, int height) {
        if (!prefix.isEmpty()) {
            out.append("-".repeat(height)).append(' ').append(prefix);
            if (terminal) {
                out.append("   (leaf)");
            }
            out.append('\n');
        }
        for (RadixNode child : children.values()) {
            child.print(out, height + 1);
        }
    }
}
