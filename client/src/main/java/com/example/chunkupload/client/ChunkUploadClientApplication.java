package com.example.chunkupload.client;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 이어받기 가능한 청크 업로드 커맨드라인 클라이언트.
 *
 * <h3>업로드 흐름:</h3>
 * <ol>
 *   <li><b>POST /upload/initiate</b> - 세션 생성 (uploadId, chunkSize 수신)</li>
 *   <li><b>GET /upload/{id}/status</b> - 이어받기 시 서버가 보관 중인 청크 목록 조회</li>
 *   <li><b>PUT /upload/{id}/chunk/{index}</b> - 누락된 청크만 순차 전송 (실패 시 백오프 재시도)</li>
 *   <li><b>POST /upload/{id}/complete</b> - 조립 요청</li>
 * </ol>
 *
 * <pre>
 * java -jar chunk-upload-client.jar &lt;file&gt; [--server=http://localhost:9000] [--max-chunks=N]
 * </pre>
 *
 * <p>종료 코드: 0 완료, 1 미완료(재실행 시 이어받기), 2 사용법/입력 오류</p>
 */
@SpringBootApplication
public class ChunkUploadClientApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(ChunkUploadClientApplication.class, args)));
    }
}
