package com.flamingo.ai.contractqa.domain.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * An ingested contract: raw text already extracted from its source format.
 *
 * @param id caller-visible document identifier
 * @param text full document text
 * @param contentHash SHA-256 of the text, used to detect re-ingestion of identical content
 */
public record ContractDocument(String id, String text, String contentHash) {

  public static ContractDocument of(String id, String text) {
    String content = text != null ? text : "";
    return new ContractDocument(id, content, sha256(content));
  }

  private static String sha256(String content) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
