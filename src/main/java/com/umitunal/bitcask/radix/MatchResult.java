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
 * Outcome of matching a word against the prefix of a node.
 *
 * @param common the longest common prefix of the node prefix and the word
 * @param remainingPrefix the part of the node prefix after the common prefix
 * @param remainingWord the part of the word after the common prefix
 */
public record MatchResult(String common, String remainingPrefix, String remainingWord) {

    /**
     * @return the non-empty parts of this result, in order common, remaining prefix, remaining word
     */
    public List<String> nonEmptyFragments() {
        List<String> fragments = new ArrayList<>(3);
        if (!common.isEmpty()) {
            fragments.add(common);
        }
        if (!remainingPrefix.isEmpty()) {
            fragments.add(remainingPrefix);
        }
        if (!remainingWord.isEmpty()) {
            fragments.add(remainingWord);
        }
        return fragments;
    }
}
