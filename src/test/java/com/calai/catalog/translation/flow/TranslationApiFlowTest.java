package com.calai.catalog.translation.flow;

import com.calai.catalog.testsupport.BaseSpringTest;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * 走完整 HTTP → service → H2 → 快取。
 * 每個測試用自己的 locale，彼此不互相污染（context 是共用的）。
 */
@SpringBootTest
@AutoConfigureMockMvc
class TranslationApiFlowTest extends BaseSpringTest {

    @Autowired MockMvc mvc;
    @Autowired ObjectMapper om;

    @Test
    void create_duplicate_export_update_delete() throws Exception {
        long id = create("welcome.msg", "Hi", "it", "[\"web\"]");

        mvc.perform(get("/api/v1/translations/{id}", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tags[0]").value("web"));

        mvc.perform(post("/api/v1/translations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body("welcome.msg", "Hi again", "it", "[]")))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("TRANSLATION_CONFLICT"));

        exportShows("it", "welcome.msg", "Hi");
        mvc.perform(get("/api/v1/translations").param("locale", "it"))
                .andExpect(jsonPath("$.total").value(1));

        mvc.perform(put("/api/v1/translations/{id}", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"value\":\"Hello\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.value").value("Hello"));

        // ✅ 回傳前已失效：下一次 export 一定是新值
        exportShows("it", "welcome.msg", "Hello");

        mvc.perform(delete("/api/v1/translations/{id}", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Translation deleted successfully"));

        mvc.perform(get("/api/v1/translations/export").param("locale", "it"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.translations['welcome.msg']").doesNotExist())
                .andExpect(jsonPath("$.count").value(0));

        mvc.perform(get("/api/v1/translations/{id}", id))
                .andExpect(status().isNotFound());
    }

    @Test
    void tag_filtered_export_is_refreshed_after_write() throws Exception {
        create("nav.home", "Home", "nl", "[\"web\"]");

        JsonNode first = export("nl", "web");
        assertThat(first.path("translations").size()).isEqualTo(1);

        create("nav.back", "Terug", "nl", "[\"web\",\"mobile\"]");

        JsonNode second = export("nl", "web");
        assertThat(second.path("translations").has("nav.back")).isTrue();
        assertThat(second.path("count").asInt()).isEqualTo(2);

        // 同一組標籤不同順序 → 同一份結果
        JsonNode both = export("nl", "web", "mobile");
        JsonNode reversed = export("nl", "mobile", "web");
        assertThat(both.path("translations")).isEqualTo(reversed.path("translations"));
    }

    @Test
    void locale_move_refreshes_both_exports() throws Exception {
        long id = create("checkout.pay", "Pagar", "pt", "[]");
        exportShows("pt", "checkout.pay", "Pagar");
        assertThat(export("sv").path("translations").has("checkout.pay")).isFalse();

        mvc.perform(patch("/api/v1/translations/{id}", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"locale\":\"sv\",\"value\":\"Betala\"}"))
                .andExpect(status().isOk());

        assertThat(export("pt").path("translations").has("checkout.pay")).isFalse();
        exportShows("sv", "checkout.pay", "Betala");
    }

    @Test
    void tag_sync_is_idempotent_and_empty_list_clears() throws Exception {
        long id = create("menu.file", "Datei", "de", "[\"desktop\",\"web\"]");

        for (int i = 0; i < 2; i++) {
            mvc.perform(put("/api/v1/translations/{id}", id)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"tags\":[\"web\",\"desktop\",\"web\"]}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.tags[0]").value("desktop"))
                    .andExpect(jsonPath("$.tags[1]").value("web"))
                    .andExpect(jsonPath("$.tags.length()").value(2));
        }

        // 沒帶 tags → 不動
        mvc.perform(put("/api/v1/translations/{id}", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"value\":\"Datei!\"}"))
                .andExpect(jsonPath("$.tags.length()").value(2));

        mvc.perform(put("/api/v1/translations/{id}", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tags\":[]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tags.length()").value(0));

        mvc.perform(get("/api/v1/translations/tags"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tags[?(@ == 'desktop')]").exists());
    }

    @Test
    void search_filters_and_caps_page_size() throws Exception {
        create("err.not_found", "Nicht gefunden", "ja", "[\"api\"]");
        create("err.timeout", "Timeout", "ja", "[]");

        mvc.perform(get("/api/v1/translations")
                        .param("locale", "ja")
                        .param("key", "ERR.")
                        .param("per_page", "500"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.per_page").value(100))
                .andExpect(jsonPath("$.current_page").value(1))
                .andExpect(jsonPath("$.total").value(2));

        mvc.perform(get("/api/v1/search/translations")
                        .param("locale", "ja")
                        .param("tags", "api"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(1))
                .andExpect(jsonPath("$.data[0].key").value("err.not_found"));

        mvc.perform(get("/api/v1/translations/locales"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.locales[?(@ == 'ja')]").exists());
    }

    @Test
    void page_far_beyond_the_end_is_an_empty_page_not_an_error() throws Exception {
        create("far.page", "x", "hu", "[]");

        mvc.perform(get("/api/v1/translations")
                        .param("locale", "hu")
                        .param("page", String.valueOf(Integer.MAX_VALUE))
                        .param("per_page", "100"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(0))
                .andExpect(jsonPath("$.total").value(1));
    }

    @Test
    void update_into_taken_pair_is_conflict_and_changes_nothing() throws Exception {
        create("a.one", "1", "ko", "[]");
        long second = create("a.two", "2", "ko", "[]");

        mvc.perform(put("/api/v1/translations/{id}", second)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"key\":\"a.one\"}"))
                .andExpect(status().isConflict());

        mvc.perform(get("/api/v1/translations/{id}", second))
                .andExpect(jsonPath("$.key").value("a.two"));
    }

    // ===== helpers =====

    private long create(String key, String value, String locale, String tagsJson) throws Exception {
        String resp = mvc.perform(post("/api/v1/translations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(key, value, locale, tagsJson)))
                .andExpect(status().isCreated())
                .andExpect(header().exists("X-Request-Id"))
                .andReturn().getResponse().getContentAsString();
        return om.readTree(resp).path("id").asLong();
    }

    private static String body(String key, String value, String locale, String tagsJson) {
        return """
                {"key":"%s","value":"%s","locale":"%s","tags":%s}
                """.formatted(key, value, locale, tagsJson);
    }

    private JsonNode export(String locale, String... tags) throws Exception {
        var req = get("/api/v1/translations/export").param("locale", locale);
        if (tags.length > 0) req = req.param("tags", tags);
        String resp = mvc.perform(req)
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        return om.readTree(resp);
    }

    private void exportShows(String locale, String key, String value) throws Exception {
        assertThat(export(locale).path("translations").path(key).asText()).isEqualTo(value);
    }
}
