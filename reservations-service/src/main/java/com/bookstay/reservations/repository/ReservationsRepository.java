package com.bookstay.reservations.repository;

import com.bookstay.common.database.DocumentRepository;
import com.bookstay.reservations.document.ReservationDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoOperations;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.util.List;

import static org.springframework.data.mongodb.core.query.Criteria.where;
import static org.springframework.data.mongodb.core.query.Query.query;

@Repository
public class ReservationsRepository {

    private final DocumentRepository<ReservationDocument> documents;

    public ReservationsRepository(MongoOperations mongoOperations) {
        this.documents = new DocumentRepository<>(mongoOperations, ReservationDocument.class);
    }

    public ReservationDocument create(ReservationDocument reservation) {
        return documents.create(reservation);
    }

    public ReservationDocument getById(String id) {
        return documents.findOne(byId(id));
    }

    public List<ReservationDocument> findAll() {
        return documents.findMany(new Query().with(Sort.by(Sort.Direction.DESC, "timestamp")));
    }

    public List<ReservationDocument> findByUserId(String userId) {
        return documents.findMany(query(where("userId").is(userId))
                .with(Sort.by(Sort.Direction.DESC, "timestamp")));
    }

    public ReservationDocument update(String id, Update update) {
        return documents.findOneAndUpdate(byId(id), update);
    }

    public ReservationDocument delete(String id) {
        return documents.findOneAndDelete(byId(id));
    }

    private static Query byId(String id) {
        return query(where("id").is(id));
    }
}
