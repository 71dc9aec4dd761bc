package com.mediaindex.scanner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;

/**
 * {@link MediaSource} backed by a relational database reached through JDBC.
 * <p>
 * Workflow:
 * <ul>
 *   <li>{@link MediaCollections#AUDIO_MEDIA} reads table {@code audio_media}.</li>
 *   <li>{@link MediaCollections#PLAYLISTS} reads table {@code audio_playlists}.</li>
 *   <li>A membership collection joins {@code audio_playlists_map} with {@code audio_media} for one
 *       playlist. The song id is exposed as {@code audio_id} and {@code _id} is the membership entry.
 *       Native order is {@code play_order}.</li>
 * </ul>
 * The selection and sort order are applied around the collection query, so they may refer to any
 * column the collection exposes. They are inserted as SQL text and must come from trusted code.
 * <p>
 * Error handling: a failure to connect or execute is logged and reported as "no result" (null).
 * Each successful query opens its own connection, owned and closed by the returned {@link QueryResult}.
 *
 * @author Media Scanner Team
 * @since 1.0
 */
public class JdbcMediaSource implements MediaSource {
    private static final Logger logger = LoggerFactory.getLogger(JdbcMediaSource.class);

    private static final String AUDIO_MEDIA_SQL = "SELECT * FROM audio_media";
    private static final String PLAYLISTS_SQL = "SELECT * FROM audio_playlists";
    private static final String PLAYLIST_MEMBERS_SQL = "SELECT pm._id AS _id, pm.audio_id, pm.playlist_id, pm.play_order, " +
            "m.title, m.artist, m.album, m.year, m.track, m.composer, m.duration, m._size, m._data, " +
            "m.date_added, m.date_modified, m.is_music " +
            "FROM audio_playlists_map pm JOIN audio_media m ON m._id = pm.audio_id " +
            "WHERE pm.playlist_id = ?";
    private static final String PLAYLIST_MEMBERS_ORDER = "play_order ASC";

    private final String url;
    private final String user;
    private final String password;

    /**
     * Constructs a JdbcMediaSource with the given connection parameters.
     * @param url JDBC URL
     * @param user Database user
     * @param password Database password
     */
    public JdbcMediaSource(String url, String user, String password) {
        this.url = url;
        this.user = user;
        this.password = password;
    }

    /**
     * Constructs a JdbcMediaSource from scanner configuration.
     * @param config connection settings
     */
    public JdbcMediaSource(ScannerConfig config) {
        this(config.dbUrl(), config.dbUser(), config.dbPassword());
    }

    /**
     * Opens a new database connection.
     * @return Connection
     * @throws SQLException if connection fails
     */
    public Connection connect() throws SQLException {
        return DriverManager.getConnection(url, user, password);
    }

    @Override
    public QueryResult query(String collection, String selection, String sortOrder) {
        Long playlistId = MediaCollections.parsePlaylistId(collection);
        String sql = buildSql(collection, playlistId, selection, sortOrder);
        Connection conn = null;
        PreparedStatement ps = null;
        try {
            conn = connect();
            ps = conn.prepareStatement(sql);
            if (playlistId != null) ps.setLong(1, playlistId);
            ResultSet rs = ps.executeQuery();
            logger.debug("Queried {}: {}", collection, sql);
            return new JdbcQueryResult(conn, ps, rs);
        } catch (SQLException e) {
            logger.error("Error querying {}: {}", collection, e.getMessage());
            closeQuietly(ps);
            closeQuietly(conn);
            return null;
        }
    }

    /**
     * Builds the SQL for one query.
     * @throws IllegalArgumentException if the collection is unknown
     */
    static String buildSql(String collection, Long playlistId, String selection, String sortOrder) {
        String base;
        String nativeOrder = null;
        if (MediaCollections.AUDIO_MEDIA.equals(collection)) {
            base = AUDIO_MEDIA_SQL;
        } else if (MediaCollections.PLAYLISTS.equals(collection)) {
            base = PLAYLISTS_SQL;
        } else if (playlistId != null) {
            base = PLAYLIST_MEMBERS_SQL;
            nativeOrder = PLAYLIST_MEMBERS_ORDER;
        } else {
            throw new IllegalArgumentException("Unknown media collection: " + collection);
        }
        StringBuilder sql = new StringBuilder("SELECT * FROM (").append(base).append(") AS v");
        if (selection != null && !selection.isBlank()) sql.append(" WHERE ").append(selection);
        String order = sortOrder != null && !sortOrder.isBlank() ? sortOrder : nativeOrder;
        if (order != null) sql.append(" ORDER BY ").append(order);
        return sql.toString();
    }

    private static void closeQuietly(AutoCloseable resource) {
        if (resource == null) return;
        try {
            resource.close();
        } catch (Exception e) {
            logger.warn("Failed to close {}: {}", resource.getClass().getSimpleName(), e.getMessage());
        }
    }

    /**
     * {@link QueryResult} over a JDBC result set. Owns the statement and the connection.
     * <p>
     * {@link #hasRows()} fetches the first row itself and hands it out on the following
     * {@link #next()}, so only {@link ResultSet#next()} is needed from the driver.
     */
    static final class JdbcQueryResult implements QueryResult {
        private final Connection conn;
        private final Statement stmt;
        private final ResultSet rs;
        private boolean closed;
        private boolean started;
        private boolean anyRow;
        // result of a fetch made by hasRows() that next() has not returned yet
        private Boolean pending;

        JdbcQueryResult(Connection conn, Statement stmt, ResultSet rs) {
            this.conn = conn;
            this.stmt = stmt;
            this.rs = rs;
        }

        @Override
        public boolean hasRows() {
            if (!started) {
                started = true;
                pending = advance();
            }
            return anyRow;
        }

        @Override
        public boolean next() {
            started = true;
            if (pending != null) {
                boolean fetched = pending;
                pending = null;
                return fetched;
            }
            return advance();
        }

        private boolean advance() {
            try {
                boolean moved = rs.next();
                if (moved) anyRow = true;
                return moved;
            } catch (SQLException e) {
                throw new MediaSourceException("Failed to advance result set", e);
            }
        }

        @Override
        public int columnIndex(String columnName) {
            try {
                ResultSetMetaData meta = rs.getMetaData();
                for (int i = 1; i <= meta.getColumnCount(); i++) {
                    if (meta.getColumnLabel(i).equalsIgnoreCase(columnName)) return i - 1;
                }
                return -1;
            } catch (SQLException e) {
                throw new MediaSourceException("Failed to read result metadata", e);
            }
        }

        @Override
        public boolean isNull(int columnIndex) {
            try {
                return rs.getObject(columnIndex + 1) == null;
            } catch (SQLException e) {
                throw new MediaSourceException("Failed to read column " + columnIndex, e);
            }
        }

        @Override
        public String getString(int columnIndex) {
            try {
                return rs.getString(columnIndex + 1);
            } catch (SQLException e) {
                throw new MediaSourceException("Failed to read column " + columnIndex, e);
            }
        }

        @Override
        public long getLong(int columnIndex) {
            try {
                return rs.getLong(columnIndex + 1);
            } catch (SQLException e) {
                throw new MediaSourceException("Failed to read column " + columnIndex, e);
            }
        }

        @Override
        public void close() {
            if (closed) return;
            closed = true;
            closeQuietly(rs);
            closeQuietly(stmt);
            closeQuietly(conn);
        }
    }
}
