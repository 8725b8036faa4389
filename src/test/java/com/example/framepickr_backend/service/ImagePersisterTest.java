package com.example.framepickr_backend.service;

import com.example.framepickr_backend.exception.StorageException;
import com.example.framepickr_backend.model.ImageCandidate;
import com.example.framepickr_backend.model.MetricSet;
import com.example.framepickr_backend.model.NormalizedImage;
import com.example.framepickr_backend.model.PersistOutcome;
import com.example.framepickr_backend.model.ScoredCandidate;
import com.example.framepickr_backend.service.Interfaces.ImageStore;
import com.example.framepickr_backend.support.TestImages;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.awt.image.BufferedImage;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ImagePersisterTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:15:30.123Z"), ZoneOffset.UTC);

    @Mock
    private ImageStore store;
    private ImagePersister persister;

    @BeforeEach
    void setUp() {
        persister = new ImagePersister(store, Runnable::run, CLOCK);
    }

    private static ScoredCandidate scored(int index, String filename, boolean transformed) {
        BufferedImage pixels = TestImages.uniform(4, 4, 100);
        NormalizedImage image = transformed
                ? new NormalizedImage(pixels, new byte[]{1, 2}, "image/jpeg", ".jpg", true)
                : new NormalizedImage(pixels, new byte[]{3, 4}, "image/png", ".png", false);
        return ScoredCandidate.ok(new ImageCandidate(index, filename, null, new byte[]{0}), image, MetricSet.empty(), 1.0);
    }

    @Test
    void storageNameIsSanitizedAndStamped() {
        assertThat(persister.storageName("My Photo (1).JPG", ".jpg"))
                .matches("My_Photo__1_-20240501101530123-[0-9a-f]{12}\\.jpg");
        assertThat(persister.storageName("../../etc/passwd", ".png"))
                .matches("passwd-20240501101530123-[0-9a-f]{12}\\.png");
        assertThat(persister.storageName(".hidden", ".jpg")).startsWith("hidden-");
        assertThat(persister.storageName("", ".jpg")).startsWith("image-");
        assertThat(persister.storageName("a".repeat(200) + ".jpg", ".jpg").indexOf('-')).isEqualTo(60);
    }

    @Test
    void twoUploadsWithTheSameNameGetDistinctKeys() {
        assertThat(persister.storageName("same.jpg", ".jpg")).isNotEqualTo(persister.storageName("same.jpg", ".jpg"));
    }

    @Test
    void untransformedKeepsDecodedExtensionTransformedUsesJpeg() {
        when(store.store(any(), anyString(), anyString())).thenAnswer(inv -> "/uploads/" + inv.getArgument(1));

        Map<Integer, PersistOutcome> outcomes = persister.persist(List.of(scored(0, "a.PNG", false), scored(1, "b.png", true)));

        assertThat(outcomes.get(0).storedName()).startsWith("a-").endsWith(".png");
        assertThat(outcomes.get(1).storedName()).startsWith("b-").endsWith(".jpg");
        verify(store).store(any(), startsWith("b-"), eq("image/jpeg"));
    }

    @Test
    void extensionFollowsTheDecodedFormatNotTheUploadName() {
        when(store.store(any(), anyString(), anyString())).thenAnswer(inv -> "/uploads/" + inv.getArgument(1));
        byte[] jpeg = TestImages.jpeg(TestImages.uniform(4, 4, 100));
        NormalizedImage image = new NormalizedImage(TestImages.uniform(4, 4, 100), jpeg, "image/jpeg", ".jpg", false);
        ScoredCandidate mislabelled = ScoredCandidate.ok(new ImageCandidate(0, "x.png", "image/png", jpeg), image, MetricSet.empty(), 1.0);

        Map<Integer, PersistOutcome> outcomes = persister.persist(List.of(mislabelled, scored(1, "noext", false)));

        assertThat(outcomes.get(0).storedName()).startsWith("x-").endsWith(".jpg");
        assertThat(outcomes.get(1).storedName()).startsWith("noext-").endsWith(".png");
        verify(store).store(eq(jpeg), startsWith("x-"), eq("image/jpeg"));
    }

    @Test
    void oneFailedWriteDoesNotStopTheOthers() {
        when(store.store(any(), anyString(), anyString())).thenAnswer(inv -> {
            String name = inv.getArgument(1);
            if (name.startsWith("bad")) {
                throw new StorageException("disk full");
            }
            return "/uploads/" + name;
        });

        Map<Integer, PersistOutcome> outcomes = persister.persist(List.of(
                scored(2, "good.jpg", false), scored(0, "bad.jpg", false), scored(1, "fine.jpg", false)));

        assertThat(outcomes.keySet()).containsExactly(2, 0, 1);
        assertThat(outcomes.get(2).succeeded()).isTrue();
        assertThat(outcomes.get(2).locator()).isEqualTo("/uploads/" + outcomes.get(2).storedName());
        assertThat(outcomes.get(0).succeeded()).isFalse();
        assertThat(outcomes.get(0).error()).isEqualTo("disk full");
        assertThat(outcomes.get(1).succeeded()).isTrue();
    }

    @Test
    void failedCandidatesAreNotWritten() {
        ScoredCandidate failed = ScoredCandidate.failed(new ImageCandidate(0, "x.jpg", null, new byte[0]), "empty_payload");

        assertThat(persister.persist(List.of(failed))).isEmpty();
        verify(store, never()).store(any(), anyString(), anyString());
    }
}
