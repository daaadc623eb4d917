package com.lendingledger.catalog;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Descriptive metadata of a catalog item.
 */
@Value
@Builder
public class ItemMetadata {
    String title;
    String author;
    String contentUri;
    String license;
    String manifestUri;
    String provenanceUri;
    @Singular
    List<String> contributors;
}
