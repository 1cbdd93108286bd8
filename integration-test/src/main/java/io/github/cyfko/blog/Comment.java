package io.github.cyfko.blog;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;

@Entity
public class Comment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotBlank
    private String body;

    private boolean approved;

    @ManyToOne(fetch = FetchType.LAZY)
    private Post post;

    @ManyToOne(fetch = FetchType.LAZY)
    private Author author;

    public Comment() {
    }

    public Comment(String body, boolean approved, Post post, Author author) {
        this.body = body;
        this.approved = approved;
        this.post = post;
        this.author = author;
    }

    public Long getId() {
        return id;
    }

    public String getBody() {
        return body;
    }

    public boolean isApproved() {
        return approved;
    }

    public Post getPost() {
        return post;
    }

    public Author getAuthor() {
        return author;
    }
}
