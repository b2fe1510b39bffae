package com.yoursp.clientstorage.modules.storage;

import com.yoursp.clientstorage.modules.auth.ClientKeyAuthFilter;
import com.yoursp.clientstorage.service.storage.StorageService;
import com.yoursp.clientstorage.service.storage.dto.FileStatistics;
import com.yoursp.clientstorage.service.storage.dto.StoredFileRecord;
import com.yoursp.clientstorage.service.storage.exception.InvalidStoragePathException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Storage API, scoped to the namespace of the authenticated client key.
 *
 * <h3>Endpoints:</h3>
 * <ul>
 * <li>POST /storage/upload, /storage/upload-form-data: multipart upload</li>
 * <li>GET /storage/list: all files of the client</li>
 * <li>GET /storage/file/[{owner}/]{filename}: download</li>
 * <li>GET /storage/file-info/[{owner}/]{filename}: metadata</li>
 * <li>DELETE /storage/file/[{owner}/]{filename}: delete</li>
 * <li>GET /storage/statistics: usage aggregate</li>
 * </ul>
 */
@Slf4j
@RestController
@RequestMapping("/${storage.api-prefix:storage}")
@RequiredArgsConstructor
public class StorageController {

    private final StorageService storageService;

    @PostMapping({ "/upload", "/upload-form-data" })
    public StoredFileRecord upload(@RequestParam(value = "file", required = false) MultipartFile file,
            @RequestParam(value = "owner", required = false) String owner,
            HttpServletRequest request) throws IOException {
        String clientKey = requireClientKey(request);
        if (file == null) {
            throw new InvalidStoragePathException("No file uploaded");
        }
        return storageService.save(clientKey, file.getOriginalFilename(), file.getBytes(),
                file.getContentType(), owner);
    }

    @GetMapping("/list")
    public List<StoredFileRecord> list(HttpServletRequest request) {
        return storageService.list(requireClientKey(request));
    }

    @GetMapping({ "/file/{filename}", "/file/{owner}/{filename}" })
    public ResponseEntity<Resource> download(@PathVariable(required = false) String owner,
            @PathVariable String filename,
            HttpServletRequest request) {
        String clientKey = requireClientKey(request);
        String reference = reference(owner, filename);

        StoredFileRecord info = storageService.info(clientKey, reference);
        Path path = storageService.fetchPath(clientKey, reference);
        log.debug("Serving {} ({} bytes)", info.getRelativePath(), info.getSize());

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.parseMediaType(info.getMimeType()));
        headers.setContentLength(info.getSize());
        headers.setContentDisposition(ContentDisposition.attachment()
                .filename(info.getOriginalName(), StandardCharsets.UTF_8)
                .build());

        return ResponseEntity.ok()
                .headers(headers)
                .body(new FileSystemResource(path));
    }

    @GetMapping({ "/file-info/{filename}", "/file-info/{owner}/{filename}" })
    public StoredFileRecord fileInfo(@PathVariable(required = false) String owner,
            @PathVariable String filename,
            HttpServletRequest request) {
        return storageService.info(requireClientKey(request), reference(owner, filename));
    }

    @DeleteMapping({ "/file/{filename}", "/file/{owner}/{filename}" })
    public Map<String, Object> delete(@PathVariable(required = false) String owner,
            @PathVariable String filename,
            HttpServletRequest request) {
        storageService.delete(requireClientKey(request), reference(owner, filename));
        return Map.of("success", true);
    }

    @GetMapping("/statistics")
    public FileStatistics statistics(HttpServletRequest request) {
        return storageService.statistics(requireClientKey(request));
    }

    // ================================================================
    // Private helpers
    // ================================================================

    private String requireClientKey(HttpServletRequest request) {
        Object clientKey = request.getAttribute(ClientKeyAuthFilter.CLIENT_KEY_ATTRIBUTE);
        if (clientKey == null) {
            throw new InvalidStoragePathException("Missing client key");
        }
        return clientKey.toString();
    }

    private static String reference(String owner, String filename) {
        return owner == null ? filename : owner + "/" + filename;
    }
}
