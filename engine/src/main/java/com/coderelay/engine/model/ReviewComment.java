package com.coderelay.engine.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;

import java.time.Instant;

/**
 * One entry in a proposal's review thread.
 *
 * Reviewers add APPROVE / REQUEST_CHANGES entries; the engine itself adds
 * SYSTEM entries (e.g. the list of conflicting paths after a failed merge).
 */
@Embeddable
public class ReviewComment {

    public enum Verdict { APPROVE, REQUEST_CHANGES, COMMENT, SYSTEM }

    public static final String SYSTEM_AUTHOR = "merge-coordinator";

    @Column(name = "author", nullable = false)
    private String author;

    @Enumerated(EnumType.STRING)
    @Column(name = "verdict", nullable = false)
    private Verdict verdict;

    @Column(name = "body", columnDefinition = "TEXT")
    private String body;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    protected ReviewComment() {}   // required by JPA

    public ReviewComment(String author, Verdict verdict, String body) {
        this.author    = author;
        this.verdict   = verdict;
        this.body      = body;
        this.createdAt = Instant.now();
    }

    public static ReviewComment system(String body) {
        return new ReviewComment(SYSTEM_AUTHOR, Verdict.SYSTEM, body);
    }

    public String  getAuthor()    { return author; }
    public Verdict getVerdict()   { return verdict; }
    public String  getBody()      { return body; }
    public Instant getCreatedAt() { return createdAt; }
}
