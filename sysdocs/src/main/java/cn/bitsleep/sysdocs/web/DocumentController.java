package cn.bitsleep.sysdocs.web;

import cn.bitsleep.sysdocs.auth.AuthUser;
import cn.bitsleep.sysdocs.auth.CurrentUser;
import cn.bitsleep.sysdocs.domain.Document;
import cn.bitsleep.sysdocs.domain.DocumentStatus;
import cn.bitsleep.sysdocs.error.ValidationException;
import cn.bitsleep.sysdocs.service.DocumentPatch;
import cn.bitsleep.sysdocs.service.DocumentService;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/documents")
@RequiredArgsConstructor
public class DocumentController {

    private final DocumentService service;
    private final CurrentUser currentUser;

    @GetMapping
    public List<DocumentResponse> list(@RequestParam(required = false) String status,
                                       @RequestParam(required = false) String priority) {
        currentUser.require();
        return service.list(status, priority).stream().map(DocumentResponse::from).toList();
    }

    // 看板：按状态分列
    @GetMapping("/board")
    public Map<DocumentStatus, List<DocumentResponse>> board(@RequestParam(required = false) String priority) {
        currentUser.require();
        Map<DocumentStatus, List<DocumentResponse>> out = new LinkedHashMap<>();
        service.board(priority).forEach((status, docs) ->
                out.put(status, docs.stream().map(DocumentResponse::from).toList()));
        return out;
    }

    @PostMapping
    public ResponseEntity<DocumentResponse> create(@RequestBody CreateDocument req) {
        AuthUser user = currentUser.require();
        Document doc = service.create(user.id(), req.title, req.content, req.status, req.priority);
        return ResponseEntity.status(HttpStatus.CREATED).body(DocumentResponse.from(doc));
    }

    @GetMapping("/{id}")
    public DocumentResponse get(@PathVariable String id) {
        currentUser.require();
        return DocumentResponse.from(service.get(id));
    }

    @RequestMapping(value = "/{id}", method = {RequestMethod.PUT, RequestMethod.PATCH})
    public DocumentResponse update(@PathVariable String id, @RequestBody JsonNode body) {
        AuthUser user = currentUser.require();
        return DocumentResponse.from(service.update(id, user.id(), user.role(), toPatch(body)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<?> delete(@PathVariable String id) {
        AuthUser user = currentUser.require();
        service.delete(id, user.id(), user.role());
        return ResponseEntity.ok(Map.of("id", id, "message", "Document deleted successfully"));
    }

    // status/priority stay strings so unknown values reach the service and come back as 400 with field detail
    @Data
    public static class CreateDocument {
        public String title;
        public String content;
        public String status;
        public String priority;
    }

    // absent fields stay unchanged; an explicit null is rejected, not treated as absent
    static DocumentPatch toPatch(JsonNode body) {
        if (body == null || !body.isObject()) {
            throw new ValidationException("body", "Request body must be a JSON object");
        }
        Map<String, String> errors = new LinkedHashMap<>();
        DocumentPatch patch = DocumentPatch.builder()
                .title(text(body, "title", errors))
                .content(text(body, "content", errors))
                .status(text(body, "status", errors))
                .priority(text(body, "priority", errors))
                .build();
        if (!errors.isEmpty()) throw new ValidationException(errors);
        return patch;
    }

    private static String text(JsonNode body, String field, Map<String, String> errors) {
        JsonNode node = body.get(field);
        if (node == null) return null;
        if (!node.isTextual()) {
            errors.put(field, StringUtils.capitalize(field) + " must be a string");
            return null;
        }
        return node.textValue();
    }
}
