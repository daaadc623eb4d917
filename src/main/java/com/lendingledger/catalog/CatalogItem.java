package com.lendingledger.catalog;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A lendable catalog entry.
 *
 * Items are never deleted; pausing an item stops new loans while leaving
 * open loans to run their course.
 */
@Entity
@Table(name = "catalog_items")
@Data
@NoArgsConstructor
public class CatalogItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String title;

    private String author;

    /**
     * Pointer to the content itself, e.g. a URI or content hash.
     */
    @Column(name = "content_uri")
    private String contentUri;

    private String license;

    @Column(name = "manifest_uri")
    private String manifestUri;

    @Column(name = "provenance_uri")
    private String provenanceUri;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "catalog_item_contributors", joinColumns = @JoinColumn(name = "item_id"))
    @OrderColumn(name = "contributor_order")
    @Column(name = "contributor")
    private List<String> contributors = new ArrayList<>();

    private boolean paused;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public CatalogItem(ItemMetadata metadata, Instant createdAt) {
        applyMetadata(metadata, createdAt);
        this.createdAt = createdAt;
    }

    public void applyMetadata(ItemMetadata metadata, Instant updatedAt) {
        this.title = metadata.getTitle();
        this.author = metadata.getAuthor();
        this.contentUri = metadata.getContentUri();
        this.license = metadata.getLicense();
        this.manifestUri = metadata.getManifestUri();
        this.provenanceUri = metadata.getProvenanceUri();
        this.contributors = new ArrayList<>(metadata.getContributors());
        this.updatedAt = updatedAt;
    }

    public void pause(Instant at) {
        this.paused = true;
        this.updatedAt = at;
    }

    public void unpause(Instant at) {
        this.paused = false;
        this.updatedAt = at;
    }
}
