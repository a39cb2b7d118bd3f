package me.botfleet.port.outbound;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.io.IOException;
import java.nio.file.Path;

/**
 * Port to the per-instance fact store. Each instance opens exactly one handle
 * at its isolation path and the orchestrator closes it when the instance goes
 * away. Calls may block on disk I/O and must not run on the orchestrator
 * thread.
 */
public interface KnowledgeStorePort {

    /**
     * Opens an exclusive handle rooted at {@code isolatedPath}, creating the
     * directory when needed.
     *
     * @throws IOException
     *             if the store cannot be opened or is already held by another
     *             handle
     */
    KnowledgeHandle open(Path isolatedPath) throws IOException;

    /**
     * Handle to an opened store.
     */
    interface KnowledgeHandle extends AutoCloseable {

        Path path();

        boolean isOpen();

        @Override
        void close() throws IOException;
    }
}
