package com.mediaindex.scanner;

import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class JdbcMediaSourceTest {

    @Test
    void testSongQueryAppliesSelectionAndSortAroundTable() {
        String sql = JdbcMediaSource.buildSql(MediaCollections.AUDIO_MEDIA, null,
            ScannerService.MUSIC_SELECTION, ScannerService.SONG_SORT_ORDER);

        assertEquals("SELECT * FROM (SELECT * FROM audio_media) AS v WHERE is_music != 0 ORDER BY title ASC, artist ASC", sql);
    }

    @Test
    void testPlaylistQueryHasNoFilterOrOrder() {
        assertEquals("SELECT * FROM (SELECT * FROM audio_playlists) AS v",
            JdbcMediaSource.buildSql(MediaCollections.PLAYLISTS, null, null, null));
    }

    @Test
    void testMemberQueryUsesPlayOrderWhenNoSortGiven() {
        String sql = JdbcMediaSource.buildSql(MediaCollections.playlistMembers(7), 7L, "is_music != 0", null);

        assertTrue(sql.contains("pm.audio_id"));
        assertTrue(sql.contains("WHERE pm.playlist_id = ?"));
        assertTrue(sql.endsWith(") AS v WHERE is_music != 0 ORDER BY play_order ASC"));
    }

    @Test
    void testUnknownCollectionIsRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> JdbcMediaSource.buildSql("audio/genres", null, null, null));
    }

    @Test
    void testConnectionFailureIsReportedAsNoResult() {
        JdbcMediaSource source = new JdbcMediaSource("jdbc:unknown-driver:nowhere", "user", "secret");

        assertNull(source.query(MediaCollections.AUDIO_MEDIA, null, null));
    }

    @Test
    void testResultSetIsReadThroughZeroBasedOffsets() throws SQLException {
        Connection conn = mock(Connection.class);
        PreparedStatement ps = mock(PreparedStatement.class);
        ResultSet rs = mock(ResultSet.class);
        ResultSetMetaData meta = mock(ResultSetMetaData.class);
        when(rs.getMetaData()).thenReturn(meta);
        when(meta.getColumnCount()).thenReturn(2);
        when(meta.getColumnLabel(1)).thenReturn("_id");
        when(meta.getColumnLabel(2)).thenReturn("title");
        when(rs.next()).thenReturn(true, false);
        when(rs.getObject(1)).thenReturn(5L);
        when(rs.getLong(1)).thenReturn(5L);
        when(rs.getObject(2)).thenReturn(null);

        QueryResult result = new JdbcMediaSource.JdbcQueryResult(conn, ps, rs);

        assertTrue(result.hasRows());
        assertEquals(0, result.columnIndex("_id"));
        assertEquals(1, result.columnIndex("TITLE"));
        assertEquals(-1, result.columnIndex("composer"));
        assertTrue(result.next());
        assertFalse(result.isNull(0));
        assertEquals(5L, result.getLong(0));
        assertTrue(result.isNull(1));
        assertFalse(result.next());
        verify(rs, times(2)).next();
    }

    @Test
    void testHasRowsWorksWithoutBeforeFirstSupport() throws SQLException {
        ResultSet rs = mock(ResultSet.class);
        when(rs.isBeforeFirst()).thenThrow(new SQLFeatureNotSupportedException("forward-only"));
        when(rs.next()).thenReturn(true, true, false);
        when(rs.getObject(1)).thenReturn("first", "second");
        when(rs.getString(1)).thenReturn("first", "second");

        QueryResult result = new JdbcMediaSource.JdbcQueryResult(mock(Connection.class), mock(PreparedStatement.class), rs);

        assertTrue(result.hasRows());
        assertTrue(result.next());
        assertEquals("first", result.getString(0));
        assertTrue(result.next());
        assertEquals("second", result.getString(0));
        assertFalse(result.next());
        assertTrue(result.hasRows());
        verify(rs, times(3)).next();
        verify(rs, never()).isBeforeFirst();
    }

    @Test
    void testHasRowsIsFalseForEmptyResult() throws SQLException {
        ResultSet rs = mock(ResultSet.class);
        when(rs.next()).thenReturn(false);

        QueryResult result = new JdbcMediaSource.JdbcQueryResult(mock(Connection.class), mock(PreparedStatement.class), rs);

        assertFalse(result.hasRows());
        assertFalse(result.next());
        verify(rs, times(1)).next();
    }

    @Test
    void testCloseReleasesResultStatementAndConnectionOnce() throws SQLException {
        Connection conn = mock(Connection.class);
        PreparedStatement ps = mock(PreparedStatement.class);
        ResultSet rs = mock(ResultSet.class);

        QueryResult result = new JdbcMediaSource.JdbcQueryResult(conn, ps, rs);
        result.close();
        result.close();

        verify(rs, times(1)).close();
        verify(ps, times(1)).close();
        verify(conn, times(1)).close();
    }

    @Test
    void testReadFailureIsRaisedAsMediaSourceException() throws SQLException {
        ResultSet rs = mock(ResultSet.class);
        when(rs.next()).thenThrow(new SQLException("connection reset"));

        QueryResult result = new JdbcMediaSource.JdbcQueryResult(mock(Connection.class), mock(PreparedStatement.class), rs);

        MediaSourceException e = assertThrows(MediaSourceException.class, result::next);
        assertEquals("connection reset", e.getCause().getMessage());
    }
}
