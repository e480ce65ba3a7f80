package com.bookstay.auth.repository;

import com.bookstay.auth.document.UserDocument;
import com.bookstay.common.database.DocumentRepository;
import org.springframework.data.mongodb.core.MongoOperations;
import org.springframework.stereotype.Repository;

import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;
import static org.springframework.data.mongodb.core.query.Query.query;

/**
 * 사용자 레포지토리 - 제네릭 {@link DocumentRepository}를 보유하고
 * 이메일 기반 조회만 추가한다.
 */
@Repository
public class UsersRepository {

    private final DocumentRepository<UserDocument> documents;

    public UsersRepository(MongoOperations mongoOperations) {
        this.documents = new DocumentRepository<>(mongoOperations, UserDocument.class);
    }

    public UserDocument create(UserDocument user) {
        return documents.create(user);
    }

    public UserDocument getById(String id) {
        return documents.findOne(query(where("id").is(id)));
    }

    public Optional<UserDocument> findById(String id) {
        return documents.find(query(where("id").is(id)));
    }

    public Optional<UserDocument> findByEmail(String email) {
        return documents.find(query(where("email").is(email)));
    }

    public boolean existsByEmail(String email) {
        return documents.exists(query(where("email").is(email)));
    }
}
