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

package com.umitunal.bitcask.api;

import java.util.List;

/**
 * Interface for key-value storage operations.
 * This interface defines the basic operations that any storage implementation should support.
 *
 * <p>I/O failures surface as {@link com.umitunal.bitcask.exception.StorageException}.</p>
 */
public interface Storage {

    /**
     * Stores a key-value pair in the storage. A later put of the same key replaces the value.
     *
     * @param key   the key, must not be null or empty
     * @param value the value, must not be null
     */
    void put(String key, byte[] value);

    /**
     * Retrieves the value associated with the given key.
     *
     * @param key the key
     * @return the value, or null if the key doesn't exist or was deleted
     */
    byte[] get(String key);

    /**
     * Deletes the entry with the given key. Deleting an absent key is a no-op.
     *
     * @param key the key
     * @return true if the key existed
     */
    boolean delete(String key);

    /**
     * Checks if the storage contains the given key.
     *
     * @param key the key
     * @return true if the key exists
     */
    boolean containsKey(String key);

    /**
     * Returns the number of keys in the storage.
     *
     * @return the number of keys
     */
    int size();

    /**
     * Lists all keys in the storage.
     *
     * @return a list of all keys, in no particular order
     */
    List<String> listKeys();

    /**
     * Persists all in-memory state so that a restart reproduces it.
     */
    void checkpoint();

    /**
     * Shuts down the storage, persisting its state and releasing any resources.
     */
    void shutdown();
}
