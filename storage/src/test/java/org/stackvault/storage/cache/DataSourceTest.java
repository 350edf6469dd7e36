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

import java.sql.SQLException;

import org.junit.Test;
import org.slf4j.Logger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

public class DataSourceTest {

    @Test
    public void testDebugNoArgs() {
        // given
        Logger logger = mock(Logger.class);
        when(logger.isDebugEnabled()).thenReturn(true);
        // when
        DataSource.debug(logger, "select v from kv");
        // then
        verify(logger).isDebugEnabled();
        verify(logger).debug("select v from kv");
        verifyNoMoreInteractions(logger);
    }

    @Test
    public void testDebugOneStringArg() {
        // given
        Logger logger = mock(Logger.class);
        when(logger.isDebugEnabled()).thenReturn(true);
        // when
        DataSource.debug(logger, "select v from kv where k = ?", "t:app{}:0:10");
        // then
        verify(logger).isDebugEnabled();
        verify(logger).debug("{} [{}]", "select v from kv where k = ?", "'t:app{}:0:10'");
        verifyNoMoreInteractions(logger);
    }

    @Test
    public void testDebugOneNullArg() {
        // given
        Logger logger = mock(Logger.class);
        when(logger.isDebugEnabled()).thenReturn(true);
        // when
        DataSource.debug(logger, "select v from kv where k = ?", new Object[] {null});
        // then
        verify(logger).isDebugEnabled();
        verify(logger).debug("{} [{}]", "select v from kv where k = ?", "NULL");
        verifyNoMoreInteractions(logger);
    }

    @Test
    public void testDebugMultipleArgs() {
        // given
        Logger logger = mock(Logger.class);
        when(logger.isDebugEnabled()).thenReturn(true);
        // when
        DataSource.debug(logger, "merge into kv (k, v) key (k) values (?, ?)", "d:app",
                new byte[] {1, 2, 3});
        // then
        verify(logger).isDebugEnabled();
        verify(logger).debug("{} [{}]", "merge into kv (k, v) key (k) values (?, ?)",
                "'d:app', <3 bytes>");
        verifyNoMoreInteractions(logger);
    }

    @Test
    public void testDebugDisabled() {
        // given
        Logger logger = mock(Logger.class);
        // when
        DataSource.debug(logger, "select v from kv where k = ?", "x");
        // then
        verify(logger).isDebugEnabled();
        verifyNoMoreInteractions(logger);
    }

    @Test
    public void shouldDetectTable() throws Exception {
        // given
        DataSource dataSource = new DataSource();
        // when
        dataSource.execute("create table tab (a varchar, b bigint)");
        // then
        assertThat(dataSource.tableExists("tab")).isTrue();
        assertThat(dataSource.tableExists("other")).isFalse();
        assertThat(dataSource.isInMemory()).isTrue();
        dataSource.close();
    }

    @Test
    public void shouldRejectStatementsAfterClose() throws Exception {
        // given
        DataSource dataSource = new DataSource();
        // when
        dataSource.close();
        dataSource.close();
        // then
        assertThat(dataSource.isClosing()).isTrue();
        assertThatThrownBy(() -> dataSource.execute("create table tab (a varchar)"))
                .isInstanceOf(SQLException.class)
                .hasMessage("Data source is closed");
    }
}
