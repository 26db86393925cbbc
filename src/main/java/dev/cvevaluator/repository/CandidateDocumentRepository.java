package dev.cvevaluator.repository;

import dev.cvevaluator.entity.CandidateDocument;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface CandidateDocumentRepository extends JpaRepository<CandidateDocument, String> {
}
