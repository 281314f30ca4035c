package org.waabox.topicmirror.example.application;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import org.waabox.topicmirror.TopicMirror;
import org.waabox.topicmirror.TrackedTopicSet;
import org.waabox.topicmirror.session.local.LocalMessagingServer;

/** REST controller that exposes the state of the mirrored topic tree.
 *
 * <p>This controller provides two endpoints:
 * <ul>
 *   <li>{@code GET /topics} - returns the mirror root and the topics the
 *       mirror tracks</li>
 *   <li>{@code GET /topics/value} - returns the current value of a
 *       topic</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@RestController
@RequestMapping("/topics")
public class TopicController {

  /** The mirror, never null. */
  private final TopicMirror mirror;

  /** The server holding the topics, never null. */
  private final LocalMessagingServer server;

  /** Creates a new TopicController.
   *
   * @param theMirror the topic mirror, never null
   * @param theServer the messaging server, never null
   */
  public TopicController(final TopicMirror theMirror,
      final LocalMessagingServer theServer) {
    mirror = Objects.requireNonNull(theMirror, "mirror cannot be null");
    server = Objects.requireNonNull(theServer, "server cannot be null");
  }

  /** Returns the tracked topics.
   *
   * @return a map with the root and the sorted topic paths, never null
   */
  @GetMapping
  public Map<String, Object> topics() {
    final TrackedTopicSet topics = mirror.trackedTopics();
    final Map<String, Object> result = new LinkedHashMap<>();
    result.put("root", topics.root().value());
    result.put("topics", topics.snapshot());
    return result;
  }

  /** Returns the value of a topic.
   *
   * @param path the topic path, never null
   *
   * @return the value, or 404 if there is no such topic
   */
  @GetMapping("/value")
  public ResponseEntity<JsonNode> value(
      @RequestParam("path") final String path) {
    return server.value(path)
        .map(ResponseEntity::ok)
        .orElseGet(() -> ResponseEntity.notFound().build());
  }
}
