package org.waabox.topicmirror.example;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Spring Boot application entry point for the topic mirror example
 * service.
 *
 * <p>This application runs the three topic mirror programs against an
 * in-process messaging server:
 * <ul>
 *   <li>the topic mirror, creating topics below {@code cdn} from the JSON
 *       files of the data directory</li>
 *   <li>the role subscriber, subscribing every TRADER session to
 *       {@code cdn/trader-news.json}</li>
 *   <li>a topic subscriber logging every value it receives</li>
 * </ul>
 * plus a REST API to inspect the topic tree.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@SpringBootApplication
public class ExampleApplication {

  /** Launches the Spring Boot application.
   *
   * @param args the command-line arguments
   */
  public static void main(final String[] args) {
    SpringApplication.run(ExampleApplication.class, args);
  }
}
