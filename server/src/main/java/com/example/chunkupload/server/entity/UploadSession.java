package com.example.chunkupload.server.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * 청크 업로드 세션 엔티티.
 * <p>
 * 세션 메타데이터만 DB에 저장하고, 수신된 청크 인덱스 목록은 디스크의 청크 파일이 기준입니다.
 * - uploadId: 세션 고유 식별자 (UUID)
 * - chunkSize: 세션 생성 시 고정되며 이후 변경되지 않음
 * - fileSize: 클라이언트가 선언한 전체 크기 (선언하지 않았으면 null)
 * - status: OPEN → COMPLETED
 * </p>
 */
@Entity
@Table(name = "chunk_upload_session")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UploadSession {

    @Id
    @Column(name = "upload_id", length = 36)
    private String uploadId;

    /** 원본 파일명 */
    @Column(name = "file_name", nullable = false)
    private String fileName;

    @Column(name = "chunk_size", nullable = false, updatable = false)
    private int chunkSize;

    @Column(name = "file_size")
    private Long fileSize;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 20, nullable = false)
    private SessionStatus status;

    /** 클라이언트가 제공한 SHA-256 체크섬 (선택) */
    @Column(name = "checksum", length = 64)
    private String checksum;

    /** 서버 측 체크섬 검증 결과. 클라이언트 체크섬이 없으면 조립 성공 시 true */
    @Column(name = "checksum_verified")
    private boolean checksumVerified;

    /** 조립된 최종 파일 경로 (완료 후에만 존재) */
    @Column(name = "final_path", length = 1024)
    private String finalPath;

    /** 최종 파일 크기 (완료 후에만 존재) */
    @Column(name = "final_size")
    private Long finalSize;

    /** 최종 파일의 SHA-256 (완료 후에만 존재) */
    @Column(name = "final_checksum", length = 64)
    private String finalChecksum;

    @Column(name = "reg_date", updatable = false)
    private LocalDateTime regDate;

    /** 마지막 상태 변경 시각 */
    @Column(name = "upd_date")
    private LocalDateTime updDate;

    /**
     * 최종 청크 개수. 파일 크기를 모르면 -1을 반환합니다.
     * 0바이트 파일도 청크 1개(빈 청크)로 취급합니다.
     */
    public long getTotalChunks() {
        if (fileSize == null) {
            return -1;
        }
        return Math.max(1, (fileSize + chunkSize - 1) / chunkSize);
    }

    public boolean isCompleted() {
        return status == SessionStatus.COMPLETED;
    }

    @PrePersist
    protected void onCreate() {
        this.regDate = LocalDateTime.now();
        this.updDate = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        this.updDate = LocalDateTime.now();
    }
}
