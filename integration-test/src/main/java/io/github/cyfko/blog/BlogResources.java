package io.github.cyfko.blog;

import io.github.cyfko.restql.core.dispatch.ApiAction;
import io.github.cyfko.restql.core.dispatch.ResourceConfig;
import io.github.cyfko.restql.core.model.BaseScope;
import io.github.cyfko.restql.core.spi.RemoteResult;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Resources exposed by the blog. Posts cannot be destroyed through the API and author
 * credentials never leave the server.
 */
@Configuration
public class BlogResources {

    @Bean
    public ResourceConfig postsResource() {
        return ResourceConfig.builder("posts", Post.class)
                .handles(ApiAction.INDEX, ApiAction.SHOW, ApiAction.CREATE, ApiAction.UPDATE,
                        ApiAction.ASSOCIATED, ApiAction.REMOTED)
                .fields("title", "body", "status", "createdAt")
                .writable("title", "body", "status", "author")
                .belongsTo("author", "authors")
                .hasMany("comments", "comments", "post")
                .remote("commenters", "authors", (post, request) ->
                        RemoteResult.scope(BaseScope.all("authors").where("comments.post.id", post.get("id"))))
                .build();
    }

    @Bean
    public ResourceConfig commentsResource() {
        return ResourceConfig.builder("comments", Comment.class)
                .handlesAll()
                .fields("body", "approved")
                .belongsTo("post", "posts")
                .belongsTo("author", "authors")
                .build();
    }

    @Bean
    public ResourceConfig authorsResource() {
        return ResourceConfig.builder("authors", Author.class)
                .handles("index", "show", "associated")
                .fields("name", "email")
                .hasMany("posts", "posts", "author")
                .build();
    }
}
