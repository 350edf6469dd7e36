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

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import org.checkerframework.checker.nullness.qual.Nullable;

import org.stackvault.storage.cache.DataSource.BatchAdder;
import org.stackvault.storage.cache.DataSource.RowMapper;

// all four indices share one table, their keys are disjoint thanks to the cache prefixes
public class H2KeyValueStore implements KeyValueStore {

    private final DataSource dataSource;

    public H2KeyValueStore(DataSource dataSource) throws SQLException {
        this.dataSource = dataSource;
        if (!dataSource.tableExists("kv")) {
            dataSource.execute("create table kv (k varchar primary key, v blob not null)");
        }
    }

    @Override
    public @Nullable byte[] get(String key) throws SQLException {
        List<byte[]> values = dataSource.query("select v from kv where k = ?",
                new ValueRowMapper(), key);
        if (values.isEmpty()) {
            return null;
        }
        return values.get(0);
    }

    @Override
    public void put(String key, byte[] value) throws SQLException {
        dataSource.update("merge into kv (k, v) key (k) values (?, ?)", key, value);
    }

    @Override
    public void putAll(final Map<String, byte[]> entries) throws SQLException {
        if (entries.isEmpty()) {
            return;
        }
        dataSource.batchUpdate("merge into kv (k, v) key (k) values (?, ?)", new BatchAdder() {
            @Override
            public void addBatches(PreparedStatement preparedStatement) throws SQLException {
                for (Map.Entry<String, byte[]> entry : entries.entrySet()) {
                    preparedStatement.setString(1, entry.getKey());
                    preparedStatement.setBytes(2, entry.getValue());
                    preparedStatement.addBatch();
                }
            }
        });
    }

    @Override
    public void delete(String key) throws SQLException {
        dataSource.update("delete from kv where k = ?", key);
    }

    @Override
    public ImmutableList<String> keys(String prefix) throws SQLException {
        return dataSource.query("select k from kv where k like ? escape '!' order by k",
                new KeyRowMapper(), escapeLike(prefix) + '%');
    }

    private static String escapeLike(String value) {
        return value.replace("!", "!!").replace("%", "!%").replace("_", "!_");
    }

    private static class ValueRowMapper implements RowMapper<byte[]> {
        @Override
        public byte[] mapRow(ResultSet resultSet) throws SQLException {
            byte[] bytes = resultSet.getBytes(1);
            if (bytes == null) {
                throw new SQLException("Unexpected null value in kv table");
            }
            return bytes;
        }
    }

    private static class KeyRowMapper implements RowMapper<String> {
        @Override
        public String mapRow(ResultSet resultSet) throws SQLException {
            String key = resultSet.getString(1);
            if (key == null) {
                throw new SQLException("Unexpected null key in kv table");
            }
            return key;
        }
    }
}
