package com.starscape.imagevariants.features.variants.app;

import com.starscape.imagevariants.common.config.ImageProperties;
import com.starscape.imagevariants.common.exception.ErrorKind;
import com.starscape.imagevariants.common.exception.ImageVariantException;
import com.starscape.imagevariants.features.deleteimage.app.DeleteImageHandler;
import com.starscape.imagevariants.features.imagerecord.domain.ImageFormat;
import com.starscape.imagevariants.features.imagerecord.domain.ImageRecord;
import com.starscape.imagevariants.features.imagerecord.domain.ImageRecordRepository;
import com.starscape.imagevariants.features.imagerecord.domain.Placement;
import com.starscape.imagevariants.features.imagerecord.domain.StorageKind;
import com.starscape.imagevariants.features.storage.infra.LocalFileBlobStore;
import com.starscape.imagevariants.features.variants.infra.ThumbnailatorImageCodec;
import com.starscape.imagevariants.integration.TestUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class VariantResolverTest {

    private static final long ORIGINAL_ID = 1L;

    @TempDir
    Path root;

    private ImageRecordRepository repository;
    private LocalFileBlobStore blobStore;
    private ThumbnailatorImageCodec codec;
    private StoragePlacementPolicy placementPolicy;
    private VariantResolver resolver;
    private ImageRecord original;

    private final Map<Long, ImageRecord> stored = new HashMap<>();
    private final AtomicLong nextId = new AtomicLong(100);

    @BeforeEach
    void setUp() throws IOException {
        blobStore = new LocalFileBlobStore(root.toString());
        blobStore.init();
        codec = spy(new ThumbnailatorImageCodec());
        placementPolicy = new StoragePlacementPolicy(codec, blobStore,
                Clock.fixed(Instant.ofEpochSecond(1_700_000_000L), ZoneOffset.UTC), new ImageProperties());

        repository = mock(ImageRecordRepository.class);
        when(repository.save(any(ImageRecord.class))).thenAnswer(invocation -> {
            ImageRecord record = invocation.getArgument(0);
            long id = nextId.getAndIncrement();
            ReflectionTestUtils.setField(record, "id", id);
            stored.put(id, record);
            return record;
        });
        when(repository.findById(anyLong())).thenAnswer(invocation ->
                Optional.ofNullable(stored.get(invocation.<Long>getArgument(0))));
        doAnswer(invocation -> stored.remove(invocation.<ImageRecord>getArgument(0).getId()))
                .when(repository).delete(any(ImageRecord.class));
        when(repository.countByLocator(anyString())).thenAnswer(invocation -> stored.values().stream()
                .filter(record -> record.getLocator().equals(invocation.getArgument(0)))
                .count());

        resolver = new VariantResolver(repository, codec, placementPolicy, new ImageContentReader(blobStore));

        // 800x600 PNG original, file-backed
        Placement placement = placementPolicy.place(TestUtils.createRaster(800, 600), ImageFormat.PNG, "upload_test");
        original = TestUtils.persistedOriginal(ORIGINAL_ID, placement.kind(), placement.locator(),
                placement.width(), placement.height(), placement.format());
        stored.put(ORIGINAL_ID, original);
        clearInvocations(codec);
    }

    @Test
    void returnsParentWhenItAlreadyFits() {
        ImageRecord result = resolver.resolve(original, 1000, 1000);

        assertSame(original, result);
        verify(repository, never()).findChild(anyLong(), anyInt(), anyInt());
        verify(repository, never()).save(any());
        verifyNoInteractions(codec);
    }

    @Test
    void returnsParentWhenRequestEqualsItsSize() {
        assertSame(original, resolver.resolve(original, 800, 600));
    }

    @Test
    void smallVariantIsCreatedInline() {
        ImageRecord variant = resolver.resolve(original, 100, 80);

        assertEquals(ORIGINAL_ID, variant.getParentId());
        assertEquals(100, variant.getWantedWidth());
        assertEquals(80, variant.getWantedHeight());
        assertEquals(100, variant.getWidth());
        assertEquals(75, variant.getHeight());
        assertEquals(StorageKind.INLINE, variant.getStorageKind());
        assertEquals(ImageFormat.PNG, variant.getFormat());
        assertTrue(variant.getPublicLocator().startsWith("data:image/png;base64,"));
    }

    @Test
    void largeVariantIsFileBackedInParentFormat() {
        ImageRecord variant = resolver.resolve(original, 640, 480);

        assertEquals(StorageKind.FILE_BACKED, variant.getStorageKind());
        assertEquals(ImageFormat.PNG, variant.getFormat());
        assertEquals(640, variant.getWidth());
        assertEquals(480, variant.getHeight());
        assertEquals("/assets/uploads/640_480-1700000000-orig_1.png", variant.getLocator());
        assertTrue(Files.exists(root.resolve("assets/uploads/640_480-1700000000-orig_1.png")));
    }

    @Test
    void createdVariantIsReloadedById() {
        ImageRecord variant = resolver.resolve(original, 100, 80);

        ArgumentCaptor<ImageRecord> saved = ArgumentCaptor.forClass(ImageRecord.class);
        verify(repository).save(saved.capture());
        verify(repository).findById(variant.getId());
        assertEquals(saved.getValue().getId(), variant.getId());
    }

    @Test
    void secondRequestReusesStoredVariant() {
        ImageRecord first = resolver.resolve(original, 100, 80);
        when(repository.findChild(ORIGINAL_ID, 100, 80)).thenReturn(Optional.of(first));
        clearInvocations(codec);

        ImageRecord second = resolver.resolve(original, 100, 80);

        assertEquals(first.getId(), second.getId());
        verify(repository, times(1)).save(any());
        verifyNoInteractions(codec);
    }

    @Test
    void inlineParentIsDecodedFromItsPayload() {
        ImageRecord small = resolver.resolve(original, 150, 150);
        assertEquals(StorageKind.INLINE, small.getStorageKind());

        ImageRecord smaller = resolver.resolve(small, 40, 40);

        assertEquals(small.getId(), smaller.getParentId());
        assertEquals(40, smaller.getWidth());
        assertTrue(smaller.getHeight() > 0 && smaller.getHeight() < 40);
        assertEquals(StorageKind.INLINE, smaller.getStorageKind());
    }

    @Test
    void resolvesByIdAndReportsUnknownParent() {
        ImageRecord variant = resolver.resolve(ORIGINAL_ID, 100, 80);
        assertEquals(ORIGINAL_ID, variant.getParentId());

        ImageVariantException ex = assertThrows(ImageVariantException.class, () -> resolver.resolve(999L, 100, 80));
        assertEquals(ErrorKind.NOT_FOUND, ex.getKind());
    }

    @Test
    void rejectsNonPositiveRequest() {
        assertThrows(IllegalArgumentException.class, () -> resolver.resolve(original, 0, 80));
        assertThrows(IllegalArgumentException.class, () -> resolver.resolve(original, 100, -1));
    }

    @Test
    void lookupFailureIsPersistenceFailure() {
        when(repository.findChild(anyLong(), anyInt(), anyInt()))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        ImageVariantException ex = assertThrows(ImageVariantException.class, () -> resolver.resolve(original, 100, 80));
        assertEquals(ErrorKind.PERSISTENCE_FAILURE, ex.getKind());
        verify(repository, never()).save(any());
    }

    @Test
    void insertFailureLeavesFileButIsPersistenceFailure() {
        when(repository.save(any(ImageRecord.class)))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        ImageVariantException ex = assertThrows(ImageVariantException.class, () -> resolver.resolve(original, 640, 480));

        assertEquals(ErrorKind.PERSISTENCE_FAILURE, ex.getKind());
        assertTrue(Files.exists(root.resolve("assets/uploads/640_480-1700000000-orig_1.png")));
    }

    @Test
    void missingParentFileIsDecodeFailure() throws IOException {
        Files.delete(root.resolve("assets/uploads/800_600-1700000000-upload_test.png"));

        ImageVariantException ex = assertThrows(ImageVariantException.class, () -> resolver.resolve(original, 100, 80));
        assertEquals(ErrorKind.DECODE_FAILURE, ex.getKind());
        verify(repository, never()).save(any());
    }

    @Test
    void deletingOneOfTwoSameSecondDuplicatesKeepsTheSharedFile() {
        ImageRecord first = resolver.resolve(original, 640, 480);
        ImageRecord second = resolver.resolve(original, 640, 480);
        assertNotEquals(first.getId(), second.getId());
        assertEquals(first.getLocator(), second.getLocator());

        new DeleteImageHandler(repository, blobStore).handle(first.getId());

        assertTrue(Files.exists(root.resolve("assets/uploads/640_480-1700000000-orig_1.png")));
        ImageRecord thumbnail = resolver.resolve(second, 100, 80);
        assertEquals(second.getId(), thumbnail.getParentId());
    }
}
