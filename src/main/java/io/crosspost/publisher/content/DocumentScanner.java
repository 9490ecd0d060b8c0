package io.crosspost.publisher.content;

import io.crosspost.publisher.api.dto.LocalDocument;

import java.util.List;

public interface DocumentScanner {

    /**
     * The complete current set of documents, in stable scan order.
     */
    List<LocalDocument> scan();
}
