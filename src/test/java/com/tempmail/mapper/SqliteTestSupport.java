package com.tempmail.mapper;

import org.apache.ibatis.builder.xml.XMLMapperBuilder;
import org.apache.ibatis.datasource.unpooled.UnpooledDataSource;
import org.apache.ibatis.io.Resources;
import org.apache.ibatis.mapping.Environment;
import org.apache.ibatis.session.Configuration;
import org.apache.ibatis.session.SqlSession;
import org.apache.ibatis.session.SqlSessionFactoryBuilder;
import org.apache.ibatis.transaction.jdbc.JdbcTransactionFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * File-backed SQLite database with the application schema and the XML mappers loaded,
 * without a Spring context
 */
public class SqliteTestSupport implements AutoCloseable {

    private static final String[] MAPPERS = {"mapper/MailboxMapper.xml", "mapper/MessageMapper.xml"};

    private final SqlSession session;

    public SqliteTestSupport(Path dbFile) throws IOException, SQLException {
        UnpooledDataSource dataSource = new UnpooledDataSource("org.sqlite.JDBC", "jdbc:sqlite:" + dbFile, null, null);
        Configuration configuration = new Configuration(new Environment("test", new JdbcTransactionFactory(), dataSource));
        configuration.setMapUnderscoreToCamelCase(true);
        for (String resource : MAPPERS) {
            try (InputStream is = Resources.getResourceAsStream(resource)) {
                new XMLMapperBuilder(is, configuration, resource, configuration.getSqlFragments()).parse();
            }
        }
        session = new SqlSessionFactoryBuilder().build(configuration).openSession(true);

        String schema;
        try (InputStream is = Resources.getResourceAsStream("schema.sql")) {
            schema = new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
        for (String statement : schema.split(";")) {
            if (!statement.isBlank()) {
                execute(statement);
            }
        }
    }

    public MailboxMapper mailboxMapper() {
        return session.getMapper(MailboxMapper.class);
    }

    public MessageMapper messageMapper() {
        return session.getMapper(MessageMapper.class);
    }

    public void execute(String sql) throws SQLException {
        try (Statement stmt = session.getConnection().createStatement()) {
            stmt.execute(sql);
        }
    }

    /**
     * Move a mailbox's creation time into the past
     */
    public void age(String address, int minutes) throws SQLException {
        String sql = "UPDATE mailboxes SET created_at = datetime('now', ?) WHERE address = ?";
        try (PreparedStatement ps = session.getConnection().prepareStatement(sql)) {
            ps.setString(1, "-" + minutes + " minutes");
            ps.setString(2, address);
            ps.executeUpdate();
        }
    }

    public long count(String table) throws SQLException {
        try (Statement stmt = session.getConnection().createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM " + table)) {
            rs.next();
            return rs.getLong(1);
        }
    }

    @Override
    public void close() {
        session.close();
    }
}
