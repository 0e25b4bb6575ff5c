package com.codexa.ranking.repository;

import com.codexa.ranking.domain.DomainModels.Article;
import com.codexa.ranking.domain.DomainModels.Tag;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.*;

@Repository
public class ArticleJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public ArticleJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void saveUser(String userId, boolean verified) {
        jdbcTemplate.update("MERGE INTO users(id, verified) KEY(id) VALUES (?,?)", userId, verified);
    }

    @Transactional
    public void saveArticle(ArticleRow row) {
        jdbcTemplate.update(
                "MERGE INTO articles(id, user_id, title, subtitle, sub_content, content, likes_count, comments_count, read_count, quality_score, is_deleted, created_at) " +
                        "KEY(id) VALUES (?,?,?,?,?,?,?,?,?,?,FALSE,?)",
                row.id(), row.userId(), row.title(), row.subtitle(), row.subContent(), row.content() == null ? "" : row.content(),
                row.likesCount(), row.commentsCount(), row.readCount(), row.qualityScore(),
                Timestamp.from(row.createdAt()));

        jdbcTemplate.update("DELETE FROM tags_to_articles WHERE article_id = ?", row.id());
        row.tags().forEach(t -> {
            jdbcTemplate.update("MERGE INTO tags(id, name) KEY(id) VALUES (?,?)", t.id(), t.name());
            jdbcTemplate.update("INSERT INTO tags_to_articles(article_id, tag_id) VALUES (?,?)", row.id(), t.id());
        });
    }

    public boolean markDeleted(String articleId) {
        return jdbcTemplate.update("UPDATE articles SET is_deleted = TRUE WHERE id = ?", articleId) > 0;
    }

    public void recordRead(String userId, String articleId, Instant readAt) {
        jdbcTemplate.update(
                "MERGE INTO readers_to_articles(user_id, article_id, read_at) KEY(user_id, article_id) VALUES (?,?,?)",
                userId, articleId, Timestamp.from(readAt));
    }

    /** Non-deleted articles with their tags, newest first. */
    @Transactional(readOnly = true)
    public List<Article> loadActiveArticles() {
        List<ArticleTagRow> rows = jdbcTemplate.query(
                "SELECT a.id, a.title, a.subtitle, a.sub_content, a.content, a.likes_count, a.comments_count, a.read_count, a.created_at, u.verified, a.quality_score, t.id, t.name " +
                        "FROM articles a LEFT JOIN users u ON u.id = a.user_id " +
                        "LEFT JOIN tags_to_articles ta ON ta.article_id = a.id LEFT JOIN tags t ON t.id = ta.tag_id " +
                        "WHERE a.is_deleted = FALSE ORDER BY a.created_at DESC, a.id, t.id",
                (rs, n) -> new ArticleTagRow(
                        new Article(
                                rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4), rs.getString(5),
                                List.of(),
                                rs.getInt(6), rs.getInt(7), rs.getInt(8),
                                rs.getTimestamp(9).toInstant(),
                                (Boolean) rs.getObject(10),
                                (Double) rs.getObject(11)),
                        rs.getString(12) == null ? null : new Tag(rs.getString(12), rs.getString(13))));

        Map<String, Article> articles = new LinkedHashMap<>();
        Map<String, List<Tag>> tagsByArticle = new HashMap<>();
        for (ArticleTagRow row : rows) {
            articles.putIfAbsent(row.article().id(), row.article());
            List<Tag> tags = tagsByArticle.computeIfAbsent(row.article().id(), id -> new ArrayList<>());
            if (row.tag() != null) tags.add(row.tag());
        }
        return articles.values().stream()
                .map(a -> new Article(a.id(), a.title(), a.subtitle(), a.subContent(), a.content(),
                        tagsByArticle.get(a.id()),
                        a.likesCount(), a.commentsCount(), a.readCount(), a.createdAt(),
                        a.authorVerified(), a.qualityScore()))
                .toList();
    }

    /** Article ids the user has read, most recently read first. */
    public List<String> loadReadArticleIds(String userId) {
        return jdbcTemplate.query(
                "SELECT article_id FROM readers_to_articles WHERE user_id = ? ORDER BY read_at DESC, article_id",
                (rs, n) -> rs.getString(1),
                userId);
    }

    public record ArticleRow(String id,
                             String userId,
                             String title,
                             String subtitle,
                             String subContent,
                             String content,
                             List<Tag> tags,
                             int likesCount,
                             int commentsCount,
                             int readCount,
                             Instant createdAt,
                             Double qualityScore) {
        public ArticleRow {
            tags = tags == null ? List.of() : List.copyOf(tags);
        }

        public ArticleRow withCreatedAt(Instant createdAt) {
            return new ArticleRow(id, userId, title, subtitle, subContent, content, tags,
                    likesCount, commentsCount, readCount, createdAt, qualityScore);
        }
    }

    private record ArticleTagRow(Article article, Tag tag) {}
}
