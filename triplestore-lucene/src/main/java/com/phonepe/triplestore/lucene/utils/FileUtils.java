/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
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

package com.phonepe.triplestore.lucene.utils;

import com.phonepe.triplestore.core.errors.StorageIOError;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@UtilityClass
@Slf4j
public class FileUtils {

    /**
     * Ensures that the provided path exists and is a directory with the required permissions. If the path does not
     * exist and createIfNotExists is true, it will attempt to create the directory and any missing parents.
     *
     * @param path              The path to check or create.
     * @param createIfNotExists Whether to create the directory if it does not exist.
     * @param writeCheck        Whether to check for write permissions on the directory.
     * @return The absolute, normalized Path object representing the directory.
     * @throws StorageIOError If the path is not a usable directory or cannot be created when requested.
     */
    public static Path ensurePath(Path path, boolean createIfNotExists, boolean writeCheck) {
        final var absolutePath = path.toAbsolutePath().normalize();
        if (!Files.exists(absolutePath)) {
            if (!createIfNotExists) {
                throw new StorageIOError("Provided path does not exist: " + absolutePath);
            }
            try {
                Files.createDirectories(absolutePath);
                log.debug("Created directory {}", absolutePath);
            }
            catch (IOException e) {
                throw new StorageIOError("Failed to create directory: " + absolutePath, e);
            }
        }
        if (!Files.isDirectory(absolutePath)
                || !Files.isReadable(absolutePath)
                || (writeCheck && !Files.isWritable(absolutePath))) {
            throw new StorageIOError("Sanity check for %s failed. Please check it is a directory with the required permissions"
                                             .formatted(absolutePath));
        }
        return absolutePath;
    }
}
