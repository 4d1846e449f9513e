package com.inboxsearch.ingest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.inboxsearch.identity.Principal;
import com.inboxsearch.runtime.ConfigurationException;

/**
 * Reads exported messages from {@code <root>/<ownerId>/<source>.json}. The cursor is the decimal
 * offset of the next unread message.
 */
public class JsonDirectoryMessageSource implements MessageSourceFetcher {
    private final Path root;
    private final int pageSize;
    private final ObjectMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .build();

    public JsonDirectoryMessageSource(Path root, int pageSize) {
        if (pageSize < 1) {
            throw new ConfigurationException("pageSize must be >= 1");
        }
        this.root = root;
        this.pageSize = pageSize;
    }

    @Override
    public FetchPage fetch(Principal owner, String source, String cursor) throws IOException {
        Path export = root.resolve(owner.id().toString()).resolve(source + ".json");
        if (!Files.exists(export)) {
            return FetchPage.empty(cursor);
        }
        int offset = parseCursor(cursor);
        List<RawMessage> all = mapper.readValue(export.toFile(), new TypeReference<List<RawMessage>>() {
        });
        if (offset >= all.size()) {
            return new FetchPage(List.of(), String.valueOf(offset), false);
        }
        int end = Math.min(all.size(), offset + pageSize);
        List<RawMessage> page = new ArrayList<>(end - offset);
        for (int i = offset; i < end; i++) {
            RawMessage message = all.get(i);
            page.add(new RawMessage(
                    message.externalId(),
                    message.conversationExternalId(),
                    message.conversationTitle(),
                    message.participants(),
                    message.senderId(),
                    message.sentAt(),
                    message.body(),
                    message.metadata(),
                    String.valueOf(i + 1)));
        }
        return new FetchPage(page, String.valueOf(end), end < all.size());
    }

    private static int parseCursor(String cursor) throws IOException {
        if (cursor == null || cursor.isBlank()) {
            return 0;
        }
        try {
            int offset = Integer.parseInt(cursor.strip());
            if (offset < 0) {
                throw new IOException("negative cursor: " + cursor);
            }
            return offset;
        } catch (NumberFormatException e) {
            throw new IOException("cursor is not an offset: " + cursor, e);
        }
    }
}
