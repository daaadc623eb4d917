package com.lendingledger.api.dto;

import com.lendingledger.catalog.ItemMetadata;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * DTO for creating or updating catalog item metadata.
 */
@Data
public class CreateItemRequest {

    @NotBlank(message = "Title is required")
    @Size(max = 255, message = "Title must be at most 255 characters")
    private String title;

    private String author;

    private String contentUri;

    private String license;

    private String manifestUri;

    private String provenanceUri;

    private List<String> contributors = new ArrayList<>();

    public ItemMetadata toMetadata() {
        return ItemMetadata.builder()
            .title(title)
            .author(author)
            .contentUri(contentUri)
            .license(license)
            .manifestUri(manifestUri)
            .provenanceUri(provenanceUri)
            .contributors(contributors == null ? List.of() : contributors)
            .build();
    }
}
