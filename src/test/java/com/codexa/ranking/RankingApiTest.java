package com.codexa.ranking;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;

import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class RankingApiTest {
    @Autowired
    private MockMvc mockMvc;
    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void resetStore() throws Exception {
        TestArticles.clearStore(jdbcTemplate);
        mockMvc.perform(post("/api/users").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":\"author\",\"verified\":true}"))
                .andExpect(status().isNoContent());
        postArticle("k1", "Kafka consumer groups", "kafka");
        postArticle("k2", "Kafka partitions", "kafka");
        postArticle("p1", "Postgres vacuum", "postgres");
        postArticle("r1", "Redis streams", "redis");
    }

    private void postArticle(String id, String title, String tag) throws Exception {
        String body = """
                {"id":"%s","userId":"author","title":"%s","content":"body text","likesCount":3,
                 "tags":[{"id":"%s","name":"%s"}],"createdAt":"%s"}
                """.formatted(id, title, tag, tag, Instant.now().minusSeconds(3600));
        mockMvc.perform(post("/api/articles").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isNoContent());
    }

    @Test
    void searchReturnsScoredArticles() throws Exception {
        mockMvc.perform(get("/api/search").param("q", "postgres vacuum"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].article.id").value("p1"))
                .andExpect(jsonPath("$[0].score").value(greaterThan(0.0)));
    }

    @Test
    void relatedForUnknownArticleIsNotFound() throws Exception {
        mockMvc.perform(get("/api/articles/nope/related"))
                .andExpect(status().isNotFound());
    }

    @Test
    void relatedListsArticlesSharingTags() throws Exception {
        mockMvc.perform(get("/api/articles/k1/related"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].article.id").value("k2"))
                .andExpect(jsonPath("$[0].sharedTags[0]").value("kafka"));
    }

    @Test
    void trendingExposesScoreComponentsAndFallsBackOnUnknownPeriod() throws Exception {
        mockMvc.perform(get("/api/trending").param("period", "fortnight").param("limit", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].hotScore").value(greaterThan(0.0)))
                .andExpect(jsonPath("$[0].engagementScore").exists())
                .andExpect(jsonPath("$[0].timeDecay").exists())
                .andExpect(jsonPath("$[0].article.authorVerified").value(true));
    }

    @Test
    void userFeedFollowsRecordedReads() throws Exception {
        mockMvc.perform(post("/api/users/reader/reads/k2")).andExpect(status().isAccepted());

        mockMvc.perform(get("/api/users/reader/recommendations"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].article.id").value("k1"));
    }
}
