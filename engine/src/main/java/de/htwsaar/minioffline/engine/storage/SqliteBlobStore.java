package de.htwsaar.minioffline.engine.storage;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record1;
import org.jooq.SQLDialect;
import org.jooq.Table;
import org.jooq.impl.DSL;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dauerhafter {@link BlobStore} auf SQLite via jOOQ-DSL (ohne Codegenerierung).
 *
 * <p>Die Schreibreihenfolge wird über eine monoton steigende {@code seq}-Spalte abgebildet;
 * ein Überschreiben vergibt eine neue Sequenz.</p>
 */
public final class SqliteBlobStore implements BlobStore, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SqliteBlobStore.class);

    private static final Table<?> BLOBS = DSL.table(DSL.name("blobs"));
    private static final Field<String> KEY = DSL.field(DSL.name("blob_key"), String.class);
    private static final Field<byte[]> VALUE = DSL.field(DSL.name("blob_value"), byte[].class);
    private static final Field<Long> SEQ = DSL.field(DSL.name("seq"), Long.class);

    private final Connection connection;
    private final DSLContext dsl;

    /**
     * Öffnet (oder erstellt) die Datenbank.
     *
     * @param jdbcUrl z. B. {@code jdbc:sqlite:engine.db}
     * @throws SQLException wenn die Verbindung nicht aufgebaut werden kann
     */
    public SqliteBlobStore(String jdbcUrl) throws SQLException {
        this.connection = DriverManager.getConnection(Objects.requireNonNull(jdbcUrl, "jdbcUrl must not be null"));
        this.dsl = DSL.using(connection, SQLDialect.SQLITE);
        initializeSchema();
        log.info("SQLite blob store opened at {}", jdbcUrl);
    }

    private void initializeSchema() {
        dsl.execute("""
                    CREATE TABLE IF NOT EXISTS blobs (
                        blob_key TEXT PRIMARY KEY,
                        blob_value BLOB NOT NULL,
                        seq INTEGER NOT NULL
                    )
                """);
    }

    @Override
    public synchronized byte[] get(String key) {
        Record1<byte[]> r = dsl.select(VALUE).from(BLOBS).where(KEY.eq(key)).fetchOne();
        return r == null ? null : r.value1();
    }

    @Override
    public synchronized void put(String key, byte[] value) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
        long seq = nextSeq();
        dsl.insertInto(BLOBS)
                .columns(KEY, VALUE, SEQ)
                .values(key, value, seq)
                .onConflict(KEY)
                .doUpdate()
                .set(VALUE, value)
                .set(SEQ, seq)
                .execute();
    }

    @Override
    public synchronized boolean delete(String key) {
        return dsl.deleteFrom(BLOBS).where(KEY.eq(key)).execute() > 0;
    }

    @Override
    public synchronized List<String> list(String prefix) {
        String p = prefix == null ? "" : prefix;
        return dsl.select(KEY)
                .from(BLOBS)
                .where(KEY.startsWith(p))
                .orderBy(SEQ)
                .fetch(KEY);
    }

    private long nextSeq() {
        Long max = dsl.select(DSL.max(SEQ)).from(BLOBS).fetchOne(0, Long.class);
        return max == null ? 1 : max + 1;
    }

    @Override
    public void close() throws SQLException {
        connection.close();
    }
}
