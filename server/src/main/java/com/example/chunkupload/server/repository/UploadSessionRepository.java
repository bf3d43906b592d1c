package com.example.chunkupload.server.repository;

import com.example.chunkupload.server.entity.SessionStatus;
import com.example.chunkupload.server.entity.UploadSession;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * 업로드 세션 JPA 리포지토리.
 */
@Repository
public interface UploadSessionRepository extends JpaRepository<UploadSession, String> {

    /** 상태별 세션 목록 조회 */
    List<UploadSession> findByStatus(SessionStatus status);
}
