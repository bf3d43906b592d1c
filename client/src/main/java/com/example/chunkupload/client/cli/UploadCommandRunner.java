package com.example.chunkupload.client.cli;

import com.example.chunkupload.client.service.TransferController;
import com.example.chunkupload.client.service.TransferResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * 커맨드라인 진입점.
 *
 * <pre>
 * chunk-upload-client &lt;file&gt; [--server=http://host:9000] [--max-chunks=N]
 * </pre>
 *
 * <ul>
 *   <li>0: 업로드 완료</li>
 *   <li>1: 미완료. 같은 명령을 다시 실행하면 이어받음 (로컬 I/O 오류 포함)</li>
 *   <li>2: 사용법 오류, 파일 없음</li>
 * </ul>
 *
 * <p>--server 값은 application.yml의 chunk.server-url 플레이스홀더가 받습니다.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UploadCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    public static final int EXIT_COMPLETED = 0;
    public static final int EXIT_INCOMPLETE = 1;
    public static final int EXIT_USAGE = 2;

    static final String MAX_CHUNKS_OPTION = "max-chunks";

    private static final String USAGE =
            "사용법: chunk-upload-client <file> [--server=http://host:9000] [--max-chunks=N]";

    private final TransferController transferController;

    private int exitCode = EXIT_USAGE;

    @Override
    public void run(ApplicationArguments args) {
        List<String> files = args.getNonOptionArgs();
        if (files.size() != 1) {
            usageError("업로드할 파일을 하나만 지정해야 합니다. 입력: " + files);
            return;
        }

        Path source = Paths.get(files.get(0));
        if (!Files.isRegularFile(source)) {
            usageError("파일이 없거나 일반 파일이 아닙니다: " + source);
            return;
        }

        Integer maxChunks = null;
        if (args.containsOption(MAX_CHUNKS_OPTION)) {
            List<String> values = args.getOptionValues(MAX_CHUNKS_OPTION);
            maxChunks = parseMaxChunks(values);
            if (maxChunks == null) {
                usageError("--max-chunks는 1 이상의 정수여야 합니다: " + values);
                return;
            }
        }

        try {
            TransferResult result = transferController.transfer(source, maxChunks);
            if (result.isCompleted()) {
                log.info("=== [CLI] 업로드 완료 sessionId={}, finalPath={}, sha256={} ===",
                        result.getSessionId(), result.getFinalPath(), result.getChecksum());
                exitCode = EXIT_COMPLETED;
            } else {
                log.warn("=== [CLI] 업로드 미완료 ({}) sessionId={}, 이번 실행 전송={}: {} ===",
                        result.getFinalState(), result.getSessionId(), result.getChunksSent(), result.getMessage());
                log.warn("=== [CLI] 같은 명령을 다시 실행하면 이어서 업로드합니다 ===");
                exitCode = EXIT_INCOMPLETE;
            }
        } catch (IOException e) {
            log.error("=== [CLI] 로컬 파일 I/O 오류: {} ===", e.getMessage(), e);
            exitCode = EXIT_INCOMPLETE;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private static Integer parseMaxChunks(List<String> values) {
        if (values == null || values.size() != 1) {
            return null;
        }
        try {
            int parsed = Integer.parseInt(values.get(0).trim());
            return parsed > 0 ? parsed : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private void usageError(String message) {
        log.error("=== [CLI] {} ===", message);
        log.error(USAGE);
        exitCode = EXIT_USAGE;
    }
}
