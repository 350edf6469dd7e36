/*
 * Copyright 2026 the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.stackvault.storage.cache;

import java.util.Map;

import com.google.common.collect.Maps;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;

public class H2KeyValueStoreTest {

    private DataSource dataSource;
    private H2KeyValueStore store;

    @Before
    public void beforeEachTest() throws Exception {
        dataSource = new DataSource();
        store = new H2KeyValueStore(dataSource);
    }

    @After
    public void afterEachTest() throws Exception {
        dataSource.close();
    }

    @Test
    public void shouldPutAndGet() throws Exception {
        // when
        store.put("d:app", "one".getBytes(UTF_8));
        store.put("d:app", "two".getBytes(UTF_8));
        // then
        assertThat(new String(store.get("d:app"), UTF_8)).isEqualTo("two");
        assertThat(store.get("d:other")).isNull();
    }

    @Test
    public void shouldPutAll() throws Exception {
        // given
        store.put("s:app{}", "old".getBytes(UTF_8));
        Map<String, byte[]> entries = Maps.newLinkedHashMap();
        entries.put("s:app{}", "new".getBytes(UTF_8));
        entries.put("s:app{env=prod}", "prod".getBytes(UTF_8));
        // when
        store.putAll(entries);
        store.putAll(Maps.<String, byte[]>newHashMap());
        // then
        assertThat(new String(store.get("s:app{}"), UTF_8)).isEqualTo("new");
        assertThat(new String(store.get("s:app{env=prod}"), UTF_8)).isEqualTo("prod");
    }

    @Test
    public void shouldDelete() throws Exception {
        // given
        store.put("i:env:prod", "x".getBytes(UTF_8));
        // when
        store.delete("i:env:prod");
        store.delete("i:env:missing");
        // then
        assertThat(store.get("i:env:prod")).isNull();
    }

    @Test
    public void shouldListKeysByPrefix() throws Exception {
        // given
        store.put("t:app{}:0:10", new byte[0]);
        store.put("t:app{}:1:0", new byte[0]);
        store.put("t:app{env=prod}:0:10", new byte[0]);
        store.put("t:app_x{}:0:10", new byte[0]);
        store.put("t:app%{}:0:10", new byte[0]);
        store.put("d:app", new byte[0]);
        // then
        assertThat(store.keys("t:app{}:")).containsExactly("t:app{}:0:10", "t:app{}:1:0");
        assertThat(store.keys("t:app_")).containsExactly("t:app_x{}:0:10");
        assertThat(store.keys("t:app%")).containsExactly("t:app%{}:0:10");
        assertThat(store.keys("d:")).containsExactly("d:app");
        assertThat(store.keys("x:")).isEmpty();
    }

    @Test
    public void shouldReuseExistingTable() throws Exception {
        // given
        store.put("d:app", "one".getBytes(UTF_8));
        // when
        H2KeyValueStore reopened = new H2KeyValueStore(dataSource);
        // then
        assertThat(new String(reopened.get("d:app"), UTF_8)).isEqualTo("one");
    }
}
