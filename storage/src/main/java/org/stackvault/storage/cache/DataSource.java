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

import java.io.File;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.concurrent.ExecutionException;

import javax.annotation.concurrent.GuardedBy;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Joiner;
import com.google.common.base.Throwables;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.checkerframework.checker.tainting.qual.Untainted;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.stackvault.common.util.OnlyUsedByTests;

// single h2 connection, all statements are executed under one lock
public class DataSource {

    private static final Logger logger = LoggerFactory.getLogger(DataSource.class);

    private static final int CACHE_SIZE_KB =
            Integer.getInteger("stackvault.internal.h2.cacheSize", 8192);

    // null means in-memory database
    private final @Nullable File dbFile;
    private final Thread shutdownHookThread;
    private final Object lock = new Object();
    @GuardedBy("lock")
    private final Connection connection;
    private volatile int queryTimeoutSeconds;
    private volatile boolean closing = false;

    @GuardedBy("lock")
    private final LoadingCache</*@Untainted*/ String, PreparedStatement> preparedStatementCache =
            CacheBuilder.newBuilder()
                    .build(new CacheLoader</*@Untainted*/ String, PreparedStatement>() {
                        @Override
                        public PreparedStatement load(@Untainted String sql) throws SQLException {
                            return connection.prepareStatement(sql);
                        }
                    });

    // creates an in-memory database
    public DataSource() throws SQLException {
        this(null);
    }

    public DataSource(@Nullable File dbFile) throws SQLException {
        this.dbFile = dbFile;
        connection = createConnection(dbFile);
        shutdownHookThread = new ShutdownHookThread();
        Runtime.getRuntime().addShutdownHook(shutdownHookThread);
    }

    public void setQueryTimeoutSeconds(int queryTimeoutSeconds) {
        this.queryTimeoutSeconds = queryTimeoutSeconds;
    }

    public boolean isInMemory() {
        return dbFile == null;
    }

    void execute(@Untainted String sql) throws SQLException {
        debug(sql);
        synchronized (lock) {
            checkNotClosing();
            try (Statement statement = connection.createStatement()) {
                statement.execute(sql);
            }
        }
    }

    <T extends /*@NonNull*/ Object> ImmutableList<T> query(@Untainted String sql,
            RowMapper<T> rowMapper, Object... args) throws SQLException {
        debug(sql, args);
        synchronized (lock) {
            checkNotClosing();
            PreparedStatement preparedStatement = prepareStatement(sql);
            setArgs(preparedStatement, args);
            // setQueryTimeout() affects all statements of this connection (at least with h2)
            preparedStatement.setQueryTimeout(queryTimeoutSeconds);
            try (ResultSet resultSet = preparedStatement.executeQuery()) {
                List<T> mappedRows = Lists.newArrayList();
                while (resultSet.next()) {
                    mappedRows.add(rowMapper.mapRow(resultSet));
                }
                return ImmutableList.copyOf(mappedRows);
            }
            // statements are cached and only used under lock, so they are not closed here
        }
    }

    int update(@Untainted String sql, @Nullable Object... args) throws SQLException {
        debug(sql, args);
        synchronized (lock) {
            checkNotClosing();
            PreparedStatement preparedStatement = prepareStatement(sql);
            setArgs(preparedStatement, args);
            preparedStatement.setQueryTimeout(0);
            return preparedStatement.executeUpdate();
        }
    }

    int[] batchUpdate(@Untainted String sql, BatchAdder batchAdder) throws SQLException {
        debug(sql);
        synchronized (lock) {
            checkNotClosing();
            PreparedStatement preparedStatement = prepareStatement(sql);
            batchAdder.addBatches(preparedStatement);
            preparedStatement.setQueryTimeout(0);
            return preparedStatement.executeBatch();
        }
    }

    boolean tableExists(String tableName) throws SQLException {
        synchronized (lock) {
            checkNotClosing();
            try (ResultSet resultSet = connection.getMetaData().getTables(null, null,
                    tableName.toUpperCase(Locale.ENGLISH), null)) {
                return resultSet.next();
            }
        }
    }

    public void close() throws SQLException {
        synchronized (lock) {
            if (closing) {
                return;
            }
            closing = true;
            preparedStatementCache.invalidateAll();
            connection.close();
        }
        try {
            Runtime.getRuntime().removeShutdownHook(shutdownHookThread);
        } catch (IllegalStateException e) {
            // jvm is already shutting down
            logger.debug(e.getMessage(), e);
        }
    }

    @OnlyUsedByTests
    boolean isClosing() {
        return closing;
    }

    @GuardedBy("lock")
    private PreparedStatement prepareStatement(@Untainted String sql) throws SQLException {
        try {
            return preparedStatementCache.get(sql);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            Throwables.throwIfInstanceOf(cause, SQLException.class);
            // the only checked exception that the loader throws is SQLException
            logger.error(e.getMessage(), e);
            throw new SQLException(e);
        }
    }

    private void checkNotClosing() throws SQLException {
        if (closing) {
            throw new SQLException("Data source is closed");
        }
    }

    private static void setArgs(PreparedStatement preparedStatement, @Nullable Object... args)
            throws SQLException {
        for (int i = 0; i < args.length; i++) {
            preparedStatement.setObject(i + 1, args[i]);
        }
    }

    private static Connection createConnection(@Nullable File dbFile) throws SQLException {
        Properties props = new Properties();
        props.setProperty("user", "sa");
        props.setProperty("password", "");
        if (dbFile == null) {
            // db_close_on_exit=false since jvm shutdown hook is handled by DataSource
            return DriverManager.getConnection("jdbc:h2:mem:;db_close_on_exit=false", props);
        }
        String dbPath = dbFile.getAbsolutePath().replaceFirst("\\.mv\\.db$", "");
        String url = "jdbc:h2:" + dbPath + ";db_close_on_exit=false;cache_size=" + CACHE_SIZE_KB;
        return DriverManager.getConnection(url, props);
    }

    private static void debug(String sql, @Nullable Object... args) {
        debug(logger, sql, args);
    }

    @VisibleForTesting
    static void debug(Logger logger, String sql, @Nullable Object... args) {
        if (!logger.isDebugEnabled()) {
            return;
        }
        if (args.length == 0) {
            logger.debug(sql);
            return;
        }
        List<String> argStrings = Lists.newArrayList();
        for (Object arg : args) {
            if (arg instanceof String) {
                argStrings.add('\'' + (String) arg + '\'');
            } else if (arg instanceof byte[]) {
                argStrings.add("<" + ((byte[]) arg).length + " bytes>");
            } else if (arg == null) {
                argStrings.add("NULL");
            } else {
                argStrings.add(arg.toString());
            }
        }
        logger.debug("{} [{}]", sql, Joiner.on(", ").join(argStrings));
    }

    interface BatchAdder {
        void addBatches(PreparedStatement preparedStatement) throws SQLException;
    }

    interface RowMapper<T> {
        T mapRow(ResultSet resultSet) throws SQLException;
    }

    // this replaces h2's default shutdown hook (see db_close_on_exit=false above) so that
    // writes still in flight during jvm shutdown fail fast instead of logging h2 errors
    private class ShutdownHookThread extends Thread {
        @Override
        public void run() {
            try {
                // flag is set outside of the lock so that threads waiting on the lock abort
                // as soon as they obtain it
                closing = true;
                synchronized (lock) {
                    connection.close();
                }
            } catch (SQLException e) {
                logger.warn(e.getMessage(), e);
            }
        }
    }
}
