package com.example.reconcile.repository;

import com.example.reconcile.model.ReviewSession;
import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Review sessions persisted between the two review phases (collection review_sessions).
 */
public interface ReviewSessionRepository extends MongoRepository<ReviewSession, String> {
}
