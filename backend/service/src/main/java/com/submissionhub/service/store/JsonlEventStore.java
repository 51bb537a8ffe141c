package com.submissionhub.service.store;

import com.submissionhub.core.events.Event;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.locks.ReentrantReadWriteLock;

public class JsonlEventStore implements EventStore {
    private final Path file;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public JsonlEventStore(Path file) {
        this.file = file;
    }

    @Override
    public void append(Event event) {
        String line = EventCodec.toJsonLine(event);
        lock.writeLock().lock();
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            try (BufferedWriter writer = Files.newBufferedWriter(
                    file, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                writer.write(line);
                writer.newLine();
            }
        } catch (IOException e) {
            throw new IllegalStateException("Could not append " + event.type() + " to audit log " + file, e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<Event> query(EventQuery query) {
        Deque<Event> newest = new ArrayDeque<>(query.limit());
        lock.readLock().lock();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            int lineNumber = 0;
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                Event event = decode(line, lineNumber);
                if (!query.matches(event)) {
                    continue;
                }
                if (newest.size() == query.limit()) {
                    newest.removeFirst();
                }
                newest.addLast(event);
            }
        } catch (NoSuchFileException e) {
            return List.of();
        } catch (IOException e) {
            throw new IllegalStateException("Could not read audit log " + file, e);
        } finally {
            lock.readLock().unlock();
        }
        return List.copyOf(newest);
    }

    private Event decode(String line, int lineNumber) {
        try {
            return EventCodec.fromJsonLine(line);
        } catch (RuntimeException e) {
            throw new IllegalStateException("Corrupt audit log entry at line " + lineNumber + " of " + file, e);
        }
    }
}
