package com.openforge.alchemy.prompt;

import com.openforge.alchemy.config.AppConfig;
import com.openforge.alchemy.domain.Phase;
import com.openforge.alchemy.domain.RelationshipType;
import com.openforge.alchemy.relationship.RelationshipRecord;
import com.openforge.alchemy.relationship.RelationshipService;
import com.openforge.alchemy.search.SearchFilter;
import com.openforge.alchemy.search.SemanticQuery;
import com.openforge.alchemy.search.SemanticSearchResult;
import com.openforge.alchemy.search.SemanticSearchService;
import com.openforge.alchemy.search.TextSearchService;
import com.openforge.alchemy.store.StoreErrorKind;
import com.openforge.alchemy.store.StoreException;
import com.openforge.alchemy.web.GlobalApiExceptionHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class PromptControllerTest {

    private static final LocalDateTime T = LocalDateTime.of(2024, 1, 1, 12, 0);

    private PromptRecordService   records;
    private TextSearchService     textSearch;
    private SemanticSearchService semanticSearch;
    private RelationshipService   relationships;
    private MockMvc               mockMvc;

    @BeforeEach
    public void setUp() {
        records        = mock(PromptRecordService.class);
        textSearch     = mock(TextSearchService.class);
        semanticSearch = mock(SemanticSearchService.class);
        relationships  = mock(RelationshipService.class);

        this.mockMvc = MockMvcBuilders
                .standaloneSetup(new PromptController(records, textSearch, semanticSearch, relationships))
                .setControllerAdvice(new GlobalApiExceptionHandler())
                .setMessageConverters(new MappingJackson2HttpMessageConverter(new AppConfig().objectMapper()))
                .build();
    }

    @Test
    public void shouldCreateWithSnakeCaseJson() throws Exception {
        when(records.create(any())).thenReturn(sample("p-1"));

        mockMvc.perform(post("/api/prompts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"content":"Name a cafe","phase":"idea","provider":"openai","model":"gpt-4o",
                                 "max_tokens":128,"embedding":[1.0,0.0],"embedding_model":"e","embedding_dimensions":2}"""))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("p-1"))
                .andExpect(jsonPath("$.phase").value("prima-materia"))
                .andExpect(jsonPath("$.embedding_model").value("e"))
                .andExpect(jsonPath("$.usage_count").value(0))
                .andExpect(jsonPath("$.processing_time_ms").value(1450));

        ArgumentCaptor<NewPrompt> captor = ArgumentCaptor.forClass(NewPrompt.class);
        verify(records).create(captor.capture());
        assertThat(captor.getValue().phase()).isEqualTo(Phase.PRIMA_MATERIA);
        assertThat(captor.getValue().maxTokens()).isEqualTo(128);
        assertThat(captor.getValue().embedding()).containsExactly(1.0f, 0.0f);
        assertThat(captor.getValue().embeddingDimensions()).isEqualTo(2);
    }

    @Test
    public void shouldRejectBlankContentBeforeReachingTheStore() throws Exception {
        mockMvc.perform(post("/api/prompts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":\" \",\"phase\":\"solutio\",\"provider\":\"openai\",\"model\":\"m\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("invalid_argument"));
        verifyNoInteractions(records);
    }

    @Test
    public void shouldRejectUnknownPhase() throws Exception {
        mockMvc.perform(post("/api/prompts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":\"x\",\"phase\":\"nigredo\",\"provider\":\"openai\",\"model\":\"m\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("invalid_argument"));
    }

    @Test
    public void shouldReturn404ForMissingRecord() throws Exception {
        when(records.get("nope")).thenThrow(StoreException.notFound("prompt", "nope"));

        mockMvc.perform(get("/api/prompts/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("not_found"))
                .andExpect(jsonPath("$.message").value("prompt not found: nope"));
    }

    @Test
    public void shouldListTheReembeddingQueue() throws Exception {
        when(records.findWithoutEmbedding("p-1", 50)).thenReturn(List.of(sample("p-2")));

        mockMvc.perform(get("/api/prompts/unembedded").param("after", "p-1").param("limit", "50"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("p-2"));
    }

    @Test
    public void shouldDeleteWithNoContent() throws Exception {
        mockMvc.perform(delete("/api/prompts/p-1"))
                .andExpect(status().isNoContent());
        verify(records).delete("p-1");
    }

    @Test
    public void shouldSearchWithEmptyBody() throws Exception {
        when(textSearch.search(any())).thenReturn(List.of(sample("a"), sample("b")));

        mockMvc.perform(post("/api/prompts/search"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2));

        ArgumentCaptor<SearchFilter> captor = ArgumentCaptor.forClass(SearchFilter.class);
        verify(textSearch).search(captor.capture());
        assertThat(captor.getValue().effectiveLimit()).isEqualTo(SearchFilter.DEFAULT_LIMIT);
    }

    @Test
    public void shouldRunSemanticSearch() throws Exception {
        when(semanticSearch.search(any())).thenReturn(new SemanticSearchResult(List.of(sample("a")), List.of(0.93)));

        mockMvc.perform(post("/api/prompts/search/semantic")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"vector\":[1.0,0.0],\"min_similarity\":0.5,\"filter\":{\"phase\":\"solutio\",\"limit\":5}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.records[0].id").value("a"))
                .andExpect(jsonPath("$.similarities[0]").value(0.93));

        ArgumentCaptor<SemanticQuery> captor = ArgumentCaptor.forClass(SemanticQuery.class);
        verify(semanticSearch).search(captor.capture());
        assertThat(captor.getValue().minSimilarity()).isEqualTo(0.5);
        assertThat(captor.getValue().filter().phase()).isEqualTo(Phase.SOLUTIO);
        assertThat(captor.getValue().filter().limit()).isEqualTo(5);
    }

    @Test
    public void shouldRelateAndSurfaceInvalidType() throws Exception {
        when(relationships.addRelationship(eq("a"), eq("b"), eq("derived_from"), eq(0.7), isNull()))
                .thenReturn(new RelationshipRecord(1L, "a", "b", RelationshipType.DERIVED_FROM, 0.7, null, T, T));
        when(relationships.addRelationship(eq("a"), eq("b"), eq("cousin"), any(), any()))
                .thenThrow(new StoreException(StoreErrorKind.INVALID_ARGUMENT, "invalid relationship_type 'cousin'"));

        mockMvc.perform(post("/api/prompts/relationships")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"source_id\":\"a\",\"target_id\":\"b\",\"relationship_type\":\"derived_from\",\"strength\":0.7}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.type").value("derived_from"));

        mockMvc.perform(post("/api/prompts/relationships")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"source_id\":\"a\",\"target_id\":\"b\",\"relationship_type\":\"cousin\"}"))
                .andExpect(status().isBadRequest());
    }

    private static PromptRecord sample(String id) {
        return new PromptRecord(id, "content " + id, Phase.PRIMA_MATERIA, "openai", "gpt-4o", 0.7, 2000, 0,
                120, 380, 1450L, 0.0021,
                List.of("tag"), new float[]{1f, 0f}, "e", "openai", 2, 1.0, 0, null, "generated", T, T);
    }
}
