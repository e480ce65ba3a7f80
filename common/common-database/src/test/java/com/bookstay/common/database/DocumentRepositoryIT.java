package com.bookstay.common.database;

import com.bookstay.common.exception.BusinessException;
import com.bookstay.common.exception.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.mongo.DataMongoTest;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.data.mongodb.core.query.Criteria.where;
import static org.springframework.data.mongodb.core.query.Query.query;

/**
 * 실제 MongoDB(Testcontainers)에 대한 DocumentRepository 통합 테스트.
 */
@DataMongoTest
@Testcontainers
@DisplayName("DocumentRepository Integration Tests")
class DocumentRepositoryIT {

    @Container
    static MongoDBContainer mongo = new MongoDBContainer("mongo:7.0");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Configuration
    static class Config {
    }

    @Autowired
    private MongoTemplate mongoTemplate;

    private DocumentRepository<SampleDocument> repository;

    @BeforeEach
    void setUp() {
        mongoTemplate.dropCollection(SampleDocument.class);
        repository = new DocumentRepository<>(mongoTemplate, SampleDocument.class);
    }

    @Test
    @DisplayName("create 후 id로 findOne하면 같은 문서")
    void create_ThenFindById_RoundTrip() {
        SampleDocument created = repository.create(new SampleDocument("room", "suite", 2));

        SampleDocument found = repository.findOne(query(where("id").is(created.getId())));

        assertThat(found).usingRecursiveComparison().isEqualTo(created);
    }

    @Test
    @DisplayName("findMany - 비교 조건 필터, 일치 없으면 빈 리스트")
    void findMany_ComparisonFilter() {
        repository.create(new SampleDocument("a", "suite", 1));
        repository.create(new SampleDocument("b", "suite", 5));
        repository.create(new SampleDocument("c", "single", 9));

        List<SampleDocument> result = repository.findMany(
                query(where("category").is("suite").and("count").gte(2)));

        assertThat(result).extracting(SampleDocument::getName).containsExactly("b");
        assertThat(repository.findMany(query(where("category").is("penthouse")))).isEmpty();
    }

    @Test
    @DisplayName("findOneAndUpdate 두 번 - 두 업데이트의 합집합, 겹치는 필드는 나중 값")
    void findOneAndUpdate_Twice_MergesFields() {
        SampleDocument created = repository.create(new SampleDocument("a", "suite", 1));
        Query byId = query(where("id").is(created.getId()));

        repository.findOneAndUpdate(byId, new Update().set("name", "first").set("count", 10));
        SampleDocument result = repository.findOneAndUpdate(byId, new Update().set("count", 20));

        assertThat(result.getName()).isEqualTo("first");
        assertThat(result.getCount()).isEqualTo(20);
        assertThat(result.getCategory()).isEqualTo("suite");
        assertThat(result.getId()).isEqualTo(created.getId());
    }

    @Test
    @DisplayName("findOneAndDelete 후 같은 필터로 findOne하면 NotFound")
    void findOneAndDelete_ThenFindOne_NotFound() {
        SampleDocument created = repository.create(new SampleDocument("a", "suite", 1));
        Query byId = query(where("id").is(created.getId()));

        SampleDocument deleted = repository.findOneAndDelete(byId);

        assertThat(deleted.getName()).isEqualTo("a");
        assertThatThrownBy(() -> repository.findOne(byId))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.ENTITY_NOT_FOUND));
    }

    @Test
    @DisplayName("같은 문서에 대한 동시 업데이트가 유실되지 않음")
    void findOneAndUpdate_Concurrent_NoLostUpdates() {
        SampleDocument created = repository.create(new SampleDocument("a", "suite", 0));
        Query byId = query(where("id").is(created.getId()));
        ExecutorService executor = Executors.newFixedThreadPool(8);

        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            futures.add(CompletableFuture.runAsync(
                    () -> repository.findOneAndUpdate(byId, new Update().inc("count", 1)), executor));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        executor.shutdown();

        assertThat(repository.findOne(byId).getCount()).isEqualTo(50);
    }
}
