package cn.bitsleep.sysdocs.service;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial update of a document. A null field is left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentPatch {
    private String title;
    private String content;
    private String status;
    private String priority;
}
