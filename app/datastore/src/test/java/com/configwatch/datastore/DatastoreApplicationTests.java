/*
 * Where: Datastore application smoke test
 * What: Starts the full Spring context against PostgreSQL
 * Why: Catches broken wiring, properties or migrations early
 */
package com.configwatch.datastore;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class DatastoreApplicationTests extends AbstractPostgresContainerTest {

  @Test
  void contextLoads() {}
}
