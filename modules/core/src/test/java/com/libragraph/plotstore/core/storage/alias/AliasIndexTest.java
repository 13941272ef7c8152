package com.libragraph.plotstore.core.storage.alias;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.plotstore.core.storage.AliasAlreadyExistsException;
import com.libragraph.plotstore.core.storage.PermissionDeniedException;
import com.libragraph.plotstore.core.storage.UnknownImageException;
import com.libragraph.plotstore.core.storage.ValidationException;
import com.libragraph.plotstore.core.storage.metadata.ImageMetadata;
import com.libragraph.plotstore.core.storage.metadata.JsonMetadataRepository;
import com.libragraph.plotstore.types.ImageFormat;
import com.libragraph.plotstore.util.ImageIds;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class AliasIndexTest {

    @TempDir
    Path dir;

    JsonMetadataRepository metadata;
    AliasIndex index;

    @BeforeEach
    void setUp() {
        metadata = new JsonMetadataRepository(dir.resolve("metadata.json"), new ObjectMapper());
        index = new AliasIndex(metadata);
    }

    private String image(String group) {
        String guid = ImageIds.newId();
        metadata.save(ImageMetadata.created(guid, ImageFormat.PNG, 1, group, Instant.now()));
        return guid;
    }

    // --- resolution ---

    @Test
    void canonicalGuidResolvesToItself() {
        String guid = ImageIds.newId();
        assertThat(index.resolveIdentifier(guid, "sales")).contains(guid);
    }

    @Test
    void guidShapedAliasNeverShadowsTheGuid() {
        String guidShaped = "11111111-1111-4111-8111-111111111111";
        String target = image("sales");
        index.registerAlias(guidShaped, target, "sales");

        assertThat(index.listAliases("sales")).containsEntry(guidShaped, target);
        assertThat(index.resolveIdentifier(guidShaped, "sales")).contains(guidShaped);
        assertThat(index.resolveIdentifier(guidShaped, null)).contains(guidShaped);
    }

    @Test
    void unknownOrEmptyIdentifierResolvesToNothing() {
        assertThat(index.resolveIdentifier("missing-alias", "sales")).isEmpty();
        assertThat(index.resolveIdentifier("", "sales")).isEmpty();
        assertThat(index.resolveIdentifier(null, null)).isEmpty();
    }

    @Test
    void aliasResolvesInOwnGroupOnly() {
        String guid = image("sales");
        index.registerAlias("q4-report", guid, "sales");

        assertThat(index.resolveIdentifier("q4-report", "sales")).contains(guid);
        assertThat(index.resolveIdentifier("q4-report", "marketing")).isEmpty();
        assertThat(index.resolveIdentifier("q4-report", null)).isEmpty();
        assertThat(index.isClaimedByOtherGroup("q4-report", "marketing")).isTrue();
        assertThat(index.isClaimedByOtherGroup("q4-report", "sales")).isFalse();
    }

    @Test
    void publicAliasResolvesFromAnyGroup() {
        String guid = image(null);
        index.registerAlias("logo", guid, null);

        assertThat(index.resolveIdentifier("logo", null)).contains(guid);
        assertThat(index.resolveIdentifier("logo", "sales")).contains(guid);
        assertThat(index.isClaimedByOtherGroup("logo", "sales")).isFalse();
    }

    @Test
    void groupAliasShadowsPublicAlias() {
        String shared = image(null);
        String own = image("sales");
        index.registerAlias("banner", shared, null);
        index.registerAlias("banner", own, "sales");

        assertThat(index.resolveIdentifier("banner", "sales")).contains(own);
        assertThat(index.resolveIdentifier("banner", "marketing")).contains(shared);
    }

    @Test
    void sameAliasInDifferentGroupsIsIndependent() {
        String sales = image("sales");
        String marketing = image("marketing");
        index.registerAlias("report", sales, "sales");
        index.registerAlias("report", marketing, "marketing");

        assertThat(index.resolveIdentifier("report", "sales")).contains(sales);
        assertThat(index.resolveIdentifier("report", "marketing")).contains(marketing);
    }

    // --- registration ---

    @Test
    void registrationIsPersistedOnTheRecord() {
        String guid = image("sales");
        index.registerAlias("q4-report", guid, "sales");

        assertThat(metadata.get(guid)).map(ImageMetadata::alias).contains("q4-report");
        assertThat(index.getAlias(guid)).contains("q4-report");
    }

    @Test
    void reRegisteringSamePairIsNoOp() {
        String guid = image("sales");
        index.registerAlias("q4-report", guid, "sales");
        assertThatCode(() -> index.registerAlias("q4-report", guid, "sales")).doesNotThrowAnyException();
    }

    @Test
    void aliasTakenByAnotherImageIsRejected() {
        String first = image("sales");
        String second = image("sales");
        index.registerAlias("q4-report", first, "sales");

        assertThatThrownBy(() -> index.registerAlias("q4-report", second, "sales"))
                .isInstanceOf(AliasAlreadyExistsException.class)
                .hasMessageContaining(first);
        assertThat(index.getAlias(second)).isEmpty();
    }

    @Test
    void newAliasReplacesPreviousOne() {
        String guid = image("sales");
        index.registerAlias("draft", guid, "sales");
        index.registerAlias("final", guid, "sales");

        assertThat(index.resolveIdentifier("draft", "sales")).isEmpty();
        assertThat(index.resolveIdentifier("final", "sales")).contains(guid);
        assertThat(index.listAliases("sales")).containsOnlyKeys("final");
    }

    @Test
    void malformedInputIsRejected() {
        String guid = image(null);
        assertThatThrownBy(() -> index.registerAlias("ab", guid, null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Invalid alias format");
        assertThatThrownBy(() -> index.registerAlias("has space", guid, null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> index.registerAlias("valid-alias", "not-a-guid", null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Invalid GUID format");
    }

    @Test
    void unknownGuidIsRejected() {
        assertThatThrownBy(() -> index.registerAlias("valid-alias", ImageIds.newId(), null))
                .isInstanceOf(UnknownImageException.class);
    }

    @Test
    void aliasOnAnotherGroupsImageIsDenied() {
        String guid = image("sales");
        assertThatThrownBy(() -> index.registerAlias("stolen", guid, "marketing"))
                .isInstanceOf(PermissionDeniedException.class);
    }

    // --- removal ---

    @Test
    void unregisterRemovesMappingAndRecordField() {
        String guid = image("sales");
        index.registerAlias("q4-report", guid, "sales");

        assertThat(index.unregisterAlias("q4-report", "marketing")).isFalse();
        assertThat(index.unregisterAlias("q4-report", "sales")).isTrue();

        assertThat(index.resolveIdentifier("q4-report", "sales")).isEmpty();
        assertThat(metadata.get(guid)).map(ImageMetadata::alias).isEmpty();
        assertThat(index.unregisterAlias("q4-report", "sales")).isFalse();
    }

    @Test
    void evictReleasesAlias() {
        String guid = image(null);
        index.registerAlias("logo", guid, null);

        assertThat(index.evict(guid, () -> metadata.delete(guid))).isTrue();
        assertThat(index.resolveIdentifier("logo", null)).isEmpty();
        assertThat(index.getAlias(guid)).isEmpty();
    }

    // --- rebuild ---

    @Test
    void indexIsRebuiltFromRecords() {
        String guid = image("sales");
        index.registerAlias("q4-report", guid, "sales");

        AliasIndex rebuilt = new AliasIndex(
                new JsonMetadataRepository(dir.resolve("metadata.json"), new ObjectMapper()));

        assertThat(rebuilt.resolveIdentifier("q4-report", "sales")).contains(guid);
        assertThat(rebuilt.listAliases("sales")).containsEntry("q4-report", guid);
    }

    @Test
    void rebuildKeepsGroupScopeOfAliasOnPublicImage() {
        String shared = image(null);
        String other = image(null);
        index.registerAlias("logo", shared, "sales");
        index.registerAlias("logo", other, null);

        AliasIndex rebuilt = new AliasIndex(
                new JsonMetadataRepository(dir.resolve("metadata.json"), new ObjectMapper()));

        assertThat(rebuilt.listAliases("sales")).containsExactly(entry("logo", shared));
        assertThat(rebuilt.listAliases(null)).containsExactly(entry("logo", other));
        assertThat(rebuilt.resolveIdentifier("logo", "sales")).contains(shared);
        assertThat(rebuilt.resolveIdentifier("logo", "marketing")).contains(other);
    }

    @Test
    void rebuildKeepsFirstClaimOnDuplicates() {
        String first = ImageIds.newId();
        String second = ImageIds.newId();
        metadata.save(new ImageMetadata(first, ImageFormat.PNG, 1, null, "sales", "dup"));
        metadata.save(new ImageMetadata(second, ImageFormat.PNG, 1, null, "sales", "dup"));
        metadata.save(new ImageMetadata(ImageIds.newId(), ImageFormat.PNG, 1, null, null, "x y"));

        AliasIndex rebuilt = new AliasIndex(metadata);

        String expected = first.compareTo(second) < 0 ? first : second;
        assertThat(rebuilt.resolveIdentifier("dup", "sales")).contains(expected);
        assertThat(rebuilt.listAliases(null)).isEmpty();
    }

    @Test
    void listAliasesIsScopedExactly() {
        String open = image(null);
        String sales = image("sales");
        index.registerAlias("logo", open, null);
        index.registerAlias("q4-report", sales, "sales");

        assertThat(index.listAliases(null)).containsOnlyKeys("logo");
        assertThat(index.listAliases("sales")).containsOnlyKeys("q4-report");
        assertThat(index.listAliases("marketing")).isEmpty();
    }
}
