package com.faceblog.gateway.service;

import com.faceblog.gateway.testing.Fixtures;
import io.r2dbc.spi.Row;
import io.r2dbc.spi.RowMetadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.r2dbc.core.RowsFetchSpec;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.function.BiFunction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DatabaseOwnershipLookupTest {

    @Mock
    private DatabaseClient databaseClient;

    @Mock
    private DatabaseClient.GenericExecuteSpec executeSpec;

    @Mock
    private RowsFetchSpec<String> fetchSpec;

    @Mock
    private Row row;

    @Mock
    private RowMetadata metadata;

    @Captor
    private ArgumentCaptor<BiFunction<Row, RowMetadata, String>> mapper;

    private DatabaseOwnershipLookup lookup;

    @BeforeEach
    void setUp() {
        lookup = new DatabaseOwnershipLookup(databaseClient, Fixtures.properties());
    }

    @Test
    void findOwner_ArticleScopedToTenant() {
        when(databaseClient.sql("SELECT author_id FROM articles WHERE id = :id AND tenant_id = :tenantId"))
                .thenReturn(executeSpec);
        stubQuery("42", "u1");

        StepVerifier.create(lookup.findOwner("acme", "article", "42"))
                .expectNext("u1")
                .verifyComplete();

        verify(executeSpec).bind("id", "42");
        verify(executeSpec).bind("tenantId", "acme");
    }

    @Test
    void findOwner_CommentReadsAuthorColumn() {
        when(databaseClient.sql("SELECT author_id FROM comments WHERE id = :id AND tenant_id = :tenantId"))
                .thenReturn(executeSpec);
        stubQuery("c9", "u2");

        lookup.findOwner("acme", "comment", "c9").block();

        verify(executeSpec).map(mapper.capture());
        when(row.get("author_id", String.class)).thenReturn("u2");
        assertThat(mapper.getValue().apply(row, metadata)).isEqualTo("u2");
    }

    @Test
    void findOwner_MissingRowIsEmpty() {
        when(databaseClient.sql("SELECT author_id FROM articles WHERE id = :id AND tenant_id = :tenantId"))
                .thenReturn(executeSpec);
        when(executeSpec.bind("id", "404")).thenReturn(executeSpec);
        when(executeSpec.bind("tenantId", "acme")).thenReturn(executeSpec);
        doReturn(fetchSpec).when(executeSpec).map(any(BiFunction.class));
        when(fetchSpec.one()).thenReturn(Mono.empty());

        StepVerifier.create(lookup.findOwner("acme", "article", "404"))
                .verifyComplete();
    }

    @Test
    void findOwner_UnsupportedTypeRejected() {
        StepVerifier.create(lookup.findOwner("acme", "category", "3"))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(IllegalArgumentException.class)
                        .hasMessage("Unsupported resource type: category"))
                .verify();

        verifyNoInteractions(databaseClient);
    }

    private void stubQuery(String resourceId, String owner) {
        when(executeSpec.bind("id", resourceId)).thenReturn(executeSpec);
        when(executeSpec.bind("tenantId", "acme")).thenReturn(executeSpec);
        doReturn(fetchSpec).when(executeSpec).map(any(BiFunction.class));
        when(fetchSpec.one()).thenReturn(Mono.just(owner));
    }
}
