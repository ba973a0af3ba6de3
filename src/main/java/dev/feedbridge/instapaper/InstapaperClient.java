package dev.feedbridge.instapaper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.scribejava.core.model.OAuth1AccessToken;
import com.github.scribejava.core.model.OAuthRequest;
import com.github.scribejava.core.model.Response;
import com.github.scribejava.core.model.Verb;
import com.github.scribejava.core.oauth.OAuth10aService;
import dev.feedbridge.ingest.PendingEntry;
import dev.feedbridge.publish.FolderAlreadyExistsException;
import dev.feedbridge.publish.PublishException;
import dev.feedbridge.publish.PublishReceipt;
import dev.feedbridge.publish.PublishTarget;
import dev.feedbridge.sweep.SyncException;
import dev.feedbridge.sweep.SyncTarget;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One Instapaper account, spoken to through the Full API 1.1 with OAuth 1.0a signatures from
 * ScribeJava.
 *
 * <p>Every call is a signed form POST. Instapaper answers with a JSON array of typed objects
 * ({@code bookmark}, {@code folder}, {@code error}); the client picks the object it expects and
 * treats anything else as a failure.
 */
public class InstapaperClient implements PublishTarget, SyncTarget {

  private static final Logger log = LoggerFactory.getLogger(InstapaperClient.class);

  static final int FOLDER_EXISTS_ERROR_CODE = 1251;

  private final OAuth10aService service;
  private final OAuth1AccessToken accessToken;
  private final String apiUrl;
  private final ObjectMapper objectMapper;

  public InstapaperClient(
      OAuth10aService service,
      OAuth1AccessToken accessToken,
      String baseUrl,
      ObjectMapper objectMapper) {
    this.service = service;
    this.accessToken = accessToken;
    this.apiUrl = baseUrl + "/api/1.1";
    this.objectMapper = objectMapper;
  }

  @Override
  public PublishReceipt publish(PendingEntry entry, List<String> tags, @Nullable String folderId) {
    if (entry.url() == null || entry.url().isBlank()) {
      throw new PublishException("Entry from source " + entry.sourceId() + " has no URL");
    }
    OAuthRequest request = new OAuthRequest(Verb.POST, apiUrl + "/bookmarks/add");
    request.addBodyParameter("url", entry.url());
    if (entry.title() != null) {
      request.addBodyParameter("title", entry.title());
    }
    if (entry.rawContent() != null) {
      request.addBodyParameter("content", entry.rawContent());
    }
    if (!entry.destination().resolveFinalUrl()) {
      request.addBodyParameter("resolve_final_url", "0");
    }
    if (!tags.isEmpty()) {
      request.addBodyParameter("tags", tagsJson(tags));
    }
    if (folderId != null) {
      request.addBodyParameter("folder_id", folderId);
    }

    Response response = execute(request, PublishException::new);
    String body = body(response, PublishException::new);
    if (response.getCode() != 200) {
      throw new PublishException(
          "bookmarks/add returned HTTP " + response.getCode() + ": " + errorMessage(body));
    }
    JsonNode bookmark =
        firstOfType(body, "bookmark")
            .orElseThrow(() -> new PublishException("bookmarks/add returned no bookmark: " + body));
    JsonNode id = bookmark.get("bookmark_id");
    if (id == null || id.isNull()) {
      throw new PublishException("bookmarks/add returned a bookmark without id");
    }
    return new PublishReceipt(id.asText(), response.getHeader("Content-Location"));
  }

  @Override
  public Optional<String> resolveFolder(String name) {
    OAuthRequest request = new OAuthRequest(Verb.POST, apiUrl + "/folders/list");
    Response response = execute(request, PublishException::new);
    String body = body(response, PublishException::new);
    if (response.getCode() != 200) {
      throw new PublishException(
          "folders/list returned HTTP " + response.getCode() + ": " + errorMessage(body));
    }
    for (JsonNode item : parseArray(body, PublishException::new)) {
      if ("folder".equals(item.path("type").asText()) && name.equals(item.path("title").asText())) {
        return Optional.of(item.path("folder_id").asText());
      }
    }
    return Optional.empty();
  }

  @Override
  public String createFolder(String name) {
    OAuthRequest request = new OAuthRequest(Verb.POST, apiUrl + "/folders/add");
    request.addBodyParameter("title", name);
    Response response = execute(request, PublishException::new);
    String body = body(response, PublishException::new);
    if (response.getCode() == 400 && isFolderExists(body)) {
      throw new FolderAlreadyExistsException(name);
    }
    if (response.getCode() != 200) {
      throw new PublishException(
          "folders/add returned HTTP " + response.getCode() + ": " + errorMessage(body));
    }
    return firstOfType(body, "folder")
        .map(folder -> folder.path("folder_id").asText())
        .orElseThrow(() -> new PublishException("folders/add returned no folder: " + body));
  }

  @Override
  public Set<String> status(Collection<String> remoteIds) {
    OAuthRequest request = new OAuthRequest(Verb.POST, apiUrl + "/bookmarks/list");
    if (!remoteIds.isEmpty()) {
      request.addBodyParameter("have", String.join(",", remoteIds));
    }
    Response response = execute(request, SyncException::new);
    String body = body(response, SyncException::new);
    if (response.getCode() != 200) {
      throw new SyncException(
          "bookmarks/list returned HTTP " + response.getCode() + ": " + errorMessage(body));
    }
    JsonNode deleteIds;
    try {
      deleteIds = objectMapper.readTree(body).path("delete_ids");
    } catch (JsonProcessingException e) {
      throw new SyncException("bookmarks/list returned invalid JSON", e);
    }
    Set<String> deleted = new HashSet<>();
    if (deleteIds.isArray()) {
      deleteIds.forEach(id -> deleted.add(id.asText()));
    } else if (deleteIds.isTextual() && !deleteIds.asText().isBlank()) {
      for (String id : deleteIds.asText().split(",")) {
        deleted.add(id.trim());
      }
    }
    log.debug("bookmarks/list reported {} of {} ids deleted", deleted.size(), remoteIds.size());
    return deleted;
  }

  @Override
  public void delete(String remoteId) {
    OAuthRequest request = new OAuthRequest(Verb.POST, apiUrl + "/bookmarks/delete");
    request.addBodyParameter("bookmark_id", remoteId);
    Response response = execute(request, SyncException::new);
    if (response.getCode() != 200) {
      throw new SyncException(
          "bookmarks/delete of " + remoteId + " returned HTTP " + response.getCode() + ": "
              + errorMessage(body(response, SyncException::new)));
    }
  }

  private Response execute(OAuthRequest request, ErrorFactory<? extends RuntimeException> errors) {
    service.signRequest(accessToken, request);
    try {
      return service.execute(request);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw errors.create("Interrupted calling " + request.getUrl(), e);
    } catch (ExecutionException | IOException e) {
      throw errors.create("Failed calling " + request.getUrl() + ": " + e.getMessage(), e);
    }
  }

  private static String body(Response response, ErrorFactory<? extends RuntimeException> errors) {
    try {
      return response.getBody();
    } catch (IOException e) {
      throw errors.create("Failed reading Instapaper response", e);
    }
  }

  private String tagsJson(List<String> tags) {
    List<Map<String, String>> named = new ArrayList<>();
    tags.forEach(tag -> named.add(Map.of("name", tag)));
    try {
      return objectMapper.writeValueAsString(named);
    } catch (JsonProcessingException e) {
      throw new PublishException("Cannot encode tags", e);
    }
  }

  private Optional<JsonNode> firstOfType(String body, String type) {
    for (JsonNode item : parseArray(body, PublishException::new)) {
      if (type.equals(item.path("type").asText())) {
        return Optional.of(item);
      }
    }
    return Optional.empty();
  }

  private List<JsonNode> parseArray(String body, ErrorFactory<? extends RuntimeException> errors) {
    JsonNode root;
    try {
      root = objectMapper.readTree(body == null || body.isBlank() ? "[]" : body);
    } catch (JsonProcessingException e) {
      throw errors.create("Instapaper returned invalid JSON", e);
    }
    List<JsonNode> items = new ArrayList<>();
    if (root.isArray()) {
      root.forEach(items::add);
    } else {
      items.add(root);
    }
    return items;
  }

  private boolean isFolderExists(String body) {
    if (body != null && body.contains("Folder already exists")) {
      return true;
    }
    return firstOfTypeQuietly(body, "error")
        .map(error -> error.path("error_code").asInt() == FOLDER_EXISTS_ERROR_CODE)
        .orElse(false);
  }

  private Optional<JsonNode> firstOfTypeQuietly(String body, String type) {
    try {
      return firstOfType(body, type);
    } catch (PublishException e) {
      log.debug("Unparseable Instapaper error body: {}", e.getMessage());
      return Optional.empty();
    }
  }

  private String errorMessage(String body) {
    Optional<JsonNode> error = firstOfTypeQuietly(body, "error");
    if (error.isPresent()) {
      return error.get().path("message").asText() + " (code " + error.get().path("error_code").asText() + ")";
    }
    return body == null ? "" : body.length() > 200 ? body.substring(0, 200) : body;
  }

  @FunctionalInterface
  private interface ErrorFactory<E extends RuntimeException> {
    E create(String message, Throwable cause);
  }
}
