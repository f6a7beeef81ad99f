package com.schemkit.loader;

import com.schemkit.model.Document;
import java.util.List;

/** A loaded document together with the diagnostics collected while reading and resolving it. */
public final class LoaderResult {
    private final Document document;
    private final List<LoaderMessage> messages;

    public LoaderResult(Document document, List<LoaderMessage> messages) {
        this.document = document;
        this.messages = List.copyOf(messages);
    }

    public Document getDocument() {
        return document;
    }

    public List<LoaderMessage> getMessages() {
        return messages;
    }

    public boolean hasWarnings() {
        for (LoaderMessage message : messages) {
            if (message.getLevel() != LoaderMessage.Level.INFO) {
                return true;
            }
        }
        return false;
    }
}
