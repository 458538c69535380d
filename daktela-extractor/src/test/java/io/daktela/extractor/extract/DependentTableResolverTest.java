/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.daktela.extractor.extract;

import io.daktela.extractor.config.EndpointSpec;
import io.daktela.extractor.transform.RecordTransformer;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link DependentTableResolver}.
 */
@Tag("unit")
public class DependentTableResolverTest {

  private final ExtractionContext context = new ExtractionContext("acme", "activities",
      "activity", Collections.<String, List<String>>emptyMap());
  private final FakeRecordSource source = new FakeRecordSource();
  private final InMemorySink sink = new InMemorySink();
  private final DependentTableResolver resolver =
      new DependentTableResolver(source, sink, context, 100);

  @Test void testStripsTablePrefix() {
    assertEquals(Collections.singletonList("TCK-5"),
        resolver.normalizeParentIds("tickets", Collections.singletonList("tickets_TCK-5")));
  }

  @Test void testStripsRunPrefixThenTablePrefix() {
    assertEquals(Arrays.asList("TCK-5", "TCK-6", "TCK-7"),
        resolver.normalizeParentIds("tickets",
            Arrays.asList("acme_tickets_TCK-5", "ticket_TCK-6", "TCK-7")));
  }

  @Test void testPluralizationFallbacks() {
    assertEquals(Collections.singletonList("5"),
        resolver.normalizeParentIds("categories", Collections.singletonList("category_5")));
    assertEquals(Collections.singletonList("5"),
        resolver.normalizeParentIds("categories", Collections.singletonList("categories_5")));
    assertEquals(Collections.singletonList("activity_9"),
        resolver.normalizeParentIds("tickets", Collections.singletonList("activity_9")));
  }

  @Test void testIdentitySourceAliasAndInvalidSet() {
    context.addInvalidIdentifiers(Arrays.asList("activity_2", "acme_activity_3"));

    List<String> ids = resolver.normalizeParentIds("activities", Arrays.asList(
        "activity_1", "activity_2", "acme_activity_3", "acme_activity_2", "activities_4"));

    assertEquals(Arrays.asList("1", "4"), ids);
  }

  @Test void testInvalidSetOnlyAppliesToIdentitySource() {
    context.addInvalidIdentifiers(Collections.singletonList("tickets_TCK-1"));

    assertEquals(Collections.singletonList("TCK-1"),
        resolver.normalizeParentIds("tickets", Collections.singletonList("tickets_TCK-1")));
  }

  @Test void testResolveFlushesInBatches() throws Exception {
    EndpointSpec parent = EndpointSpec.builder().name("tickets").build();
    EndpointSpec child = EndpointSpec.builder().name("ticketsActivities")
        .childEndpoint("activities").parentEndpoint("tickets").parentIdField("name")
        .primaryKeys(Collections.singletonList("name")).build();
    Map<String, Object> parentRow = new LinkedHashMap<String, Object>();
    parentRow.put("name", "T1");
    Map<String, Object> parentRow2 = new LinkedHashMap<String, Object>();
    parentRow2.put("name", "T2");
    sink.writeRows("acme_tickets", Arrays.asList(parentRow, parentRow2),
        Arrays.asList("id", "name"), Collections.singletonList("id"), false);
    source.children("tickets", "T1", "activities",
        Arrays.asList(row("a1"), row("a2"), row("a3")));
    source.children("tickets", "T2", "activities", Arrays.asList(row("a4"), row("a5")));

    TableBatchWriter writer = new TableBatchWriter("ticketsActivities", "acme_ticketsActivities",
        sink, context, 2, false);
    int failures = resolver.resolve(parent, child, new RecordTransformer(child, false), writer);
    writer.finish();

    assertEquals(0, failures);
    assertEquals(Arrays.asList(2, 2, 1), sink.batchSizes.get("acme_ticketsActivities"));
    assertTrue(sink.finalized.contains("acme_ticketsActivities"));
  }

  @Test void testResolveWithoutParentTable() throws Exception {
    EndpointSpec parent = EndpointSpec.builder().name("tickets").build();
    EndpointSpec child = EndpointSpec.builder().name("ticketsActivities")
        .parentEndpoint("tickets").build();
    TableBatchWriter writer = new TableBatchWriter("ticketsActivities", "acme_ticketsActivities",
        sink, context, 2, false);

    assertEquals(0, resolver.resolve(parent, child, new RecordTransformer(child, false), writer));
    assertTrue(source.events.isEmpty());
  }

  private static Map<String, Object> row(String name) {
    Map<String, Object> row = new LinkedHashMap<String, Object>();
    row.put("name", name);
    return row;
  }
}
