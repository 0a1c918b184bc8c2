package com.tempmail.service;

import com.tempmail.config.ForwardRules;
import com.tempmail.config.RetentionPolicy;
import com.tempmail.config.ServerProperties;
import com.tempmail.domain.EnvelopeRecipient;
import com.tempmail.domain.FailureKind;
import com.tempmail.domain.InboundMail;
import com.tempmail.forward.MailForwarder;
import com.tempmail.mapper.MailboxMapper;
import com.tempmail.mapper.MessageMapper;
import com.tempmail.mapper.SqliteTestSupport;
import com.tempmail.storage.BlobStore;
import com.tempmail.storage.LocalBlobStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.dao.DataAccessResourceFailureException;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Expiry sweep against SQLite and a local blob store
 */
class ExpiryServiceTest {

    @TempDir
    Path tempDir;

    private SqliteTestSupport db;
    private LocalBlobStore blobStore;
    private BackgroundTasks tasks;
    private MailboxService mailboxService;
    private MessageService messageService;

    @BeforeEach
    void setUp() throws Exception {
        db = new SqliteTestSupport(tempDir.resolve("test.db"));
        blobStore = new LocalBlobStore(tempDir.resolve("eml"));
        tasks = new BackgroundTasks(Schedulers.immediate());
        mailboxService = new MailboxService(db.mailboxMapper());
        MessageArchiveService archiveService = new MessageArchiveService(blobStore, db.messageMapper(), new ServerProperties());
        ForwardingService forwardingService = new ForwardingService(mailboxService, mock(MailForwarder.class),
                tasks, ForwardRules.none());
        messageService = new MessageService(mailboxService, archiveService, forwardingService);
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    private ExpiryService expiryService(BlobStore store) {
        return new ExpiryService(db.messageMapper(), db.mailboxMapper(), store, tasks, new RetentionPolicy(30));
    }

    private String deliver(String address) {
        byte[] raw = ("Subject: hello\r\n\r\nbody").getBytes(StandardCharsets.UTF_8);
        return messageService.processIncomingMail(InboundMail.of(raw, "s@ext.org", EnvelopeRecipient.single(address)))
                .get(0).objectKey();
    }

    @Test
    @DisplayName("Mailbox older than the retention is removed with its messages and archives")
    void testExpiredMailboxRemoved() throws Exception {
        String key = deliver("old@temp.example.com");
        deliver("old@temp.example.com");
        db.age("old@temp.example.com", 31);

        SweepResult result = expiryService(blobStore).sweep();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.expiredBlobKeys()).isEqualTo(2);
        assertThat(result.messagesDeleted()).isEqualTo(2);
        assertThat(result.mailboxesDeleted()).isEqualTo(1);
        assertThat(mailboxService.findByAddress("old@temp.example.com")).isNull();
        assertThat(db.count("messages")).isZero();
        assertThat(Files.exists(blobStore.getRoot().resolve(key))).isFalse();
    }

    @Test
    @DisplayName("Young, pinned and favorited mailboxes survive")
    void testRetainedMailboxes() throws Exception {
        String freshKey = deliver("fresh@temp.example.com");
        String favKey = deliver("fav@temp.example.com");
        deliver("pinned@temp.example.com");
        db.age("fresh@temp.example.com", 29);
        db.age("fav@temp.example.com", 31);
        db.age("pinned@temp.example.com", 31);
        mailboxService.setFavorite("fav@temp.example.com", true);
        mailboxService.setPinned("pinned@temp.example.com", true);

        SweepResult result = expiryService(blobStore).sweep();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.mailboxesDeleted()).isZero();
        assertThat(db.count("mailboxes")).isEqualTo(3);
        assertThat(db.count("messages")).isEqualTo(3);
        assertThat(Files.exists(blobStore.getRoot().resolve(freshKey))).isTrue();
        assertThat(Files.exists(blobStore.getRoot().resolve(favKey))).isTrue();
    }

    @Test
    @DisplayName("Blob delete failure does not stop the metadata purge")
    void testBlobDeleteFailure() throws Exception {
        deliver("old@temp.example.com");
        db.age("old@temp.example.com", 45);
        BlobStore broken = mock(BlobStore.class);
        doThrow(new IOException("storage down")).when(broken).delete(anyString());

        SweepResult result = expiryService(broken).sweep();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.mailboxesDeleted()).isEqualTo(1);
        assertThat(result.blobDeletes()).singleElement()
                .satisfies(f -> assertThat(f.join()).hasValueSatisfying(
                        failure -> assertThat(failure.kind()).isEqualTo(FailureKind.SIDE_CHANNEL)));
    }

    @Test
    @DisplayName("Messages without an archive are purged without a blob delete")
    void testMessageWithoutArchive() throws Exception {
        db.mailboxMapper().insertIfAbsent("bare@temp.example.com", "bare", "temp.example.com");
        db.execute("INSERT INTO messages (mailbox_id, subject, object_key) "
                + "SELECT id, 'x', '' FROM mailboxes WHERE address = 'bare@temp.example.com'");
        db.age("bare@temp.example.com", 31);
        BlobStore store = mock(BlobStore.class);

        SweepResult result = expiryService(store).sweep();

        assertThat(result.messagesDeleted()).isEqualTo(1);
        assertThat(result.blobDeletes()).isEmpty();
        verifyNoInteractions(store);
    }

    @Test
    @DisplayName("Datastore failure: reported, nothing deleted, state back to IDLE")
    void testDatastoreFailure() {
        MessageMapper messageMapper = mock(MessageMapper.class);
        MailboxMapper mailboxMapper = mock(MailboxMapper.class);
        when(messageMapper.findExpiredObjectKeys(anyInt())).thenReturn(List.of("k/1.eml"));
        when(messageMapper.deleteExpired(anyInt())).thenThrow(new DataAccessResourceFailureException("db locked"));
        ExpiryService service = new ExpiryService(messageMapper, mailboxMapper, blobStore, tasks, new RetentionPolicy(30));

        SweepResult result = service.sweep();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.failure().kind()).isEqualTo(FailureKind.INFRASTRUCTURE);
        assertThat(result.blobDeletes()).hasSize(1);
        assertThat(service.getState()).isEqualTo(SweepState.IDLE);
        verify(mailboxMapper, never()).deleteExpired(anyInt());
    }
}
