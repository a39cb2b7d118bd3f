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

package me.botfleet.adapter.outbound.knowledge;

import lombok.extern.slf4j.Slf4j;
import me.botfleet.port.outbound.KnowledgeStorePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Filesystem knowledge store. Each handle owns its isolation directory through
 * an exclusive lock on {@code .lock}; a second open of the same directory fails
 * until the first handle is closed.
 */
@Component
@Slf4j
public class LocalKnowledgeStoreAdapter implements KnowledgeStorePort {

    static final String LOCK_FILE = ".lock";
    static final String FACTS_DIR = "facts";

    @Override
    public KnowledgeHandle open(Path isolatedPath) throws IOException {
        Path root = isolatedPath.toAbsolutePath().normalize();
        Files.createDirectories(root.resolve(FACTS_DIR));

        FileChannel channel = FileChannel.open(root.resolve(LOCK_FILE),
                StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        FileLock lock;
        try {
            lock = channel.tryLock();
        } catch (OverlappingFileLockException e) {
            channel.close();
            throw new IOException("Knowledge store already open: " + root, e);
        } catch (IOException e) {
            channel.close();
            throw e;
        }
        if (lock == null) {
            channel.close();
            throw new IOException("Knowledge store locked by another process: " + root);
        }

        log.debug("[Knowledge] Opened store at {}", root);
        return new LockedHandle(root, channel, lock);
    }

    private static final class LockedHandle implements KnowledgeHandle {

        private final Path path;
        private final FileChannel channel;
        private final FileLock lock;
        private final AtomicBoolean open = new AtomicBoolean(true);

        private LockedHandle(Path path, FileChannel channel, FileLock lock) {
            this.path = path;
            this.channel = channel;
            this.lock = lock;
        }

        @Override
        public Path path() {
            return path;
        }

        @Override
        public boolean isOpen() {
            return open.get();
        }

        @Override
        public void close() throws IOException {
            if (!open.compareAndSet(true, false)) {
                return;
            }
            try {
                if (lock.isValid()) {
                    lock.release();
                }
            } finally {
                channel.close();
            }
            log.debug("[Knowledge] Closed store at {}", path);
        }
    }
}
