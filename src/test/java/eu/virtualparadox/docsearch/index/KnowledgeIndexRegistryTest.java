package eu.virtualparadox.docsearch.index;

import eu.virtualparadox.docsearch.application.config.ApplicationConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KnowledgeIndexRegistryTest {

    @TempDir
    Path root;

    private Path autolife;
    private Path bistro;
    private ApplicationConfig config;
    private KnowledgeIndexRegistry registry;

    @BeforeEach
    void setUp() throws IOException {
        autolife = Files.createDirectory(root.resolve("autolife"));
        bistro = Files.createDirectory(root.resolve("bistro"));
        Files.writeString(autolife.resolve("pricing.txt"), "Autolife Price List\nOil change|$40|synthetic");
        Files.writeString(bistro.resolve("menu.txt"), "Menu\nSoup|$5|daily\nSalad|$7|");

        config = new ApplicationConfig();
        config.getTenants().put("bistro", bistro);
        config.getTenants().put("autolife", autolife);
        registry = new KnowledgeIndexRegistry(config, KnowledgeIndexBuilderTest.newBuilder());
    }

    @Test
    @DisplayName("Every configured tenant gets its own index")
    void loadAll() {
        registry.loadAll();

        assertThat(registry.require("autolife").size()).isEqualTo(1);
        assertThat(registry.require("bistro").size()).isEqualTo(2);
        assertThat(registry.require("autolife").chunks())
                .allSatisfy(chunk -> assertThat(chunk.tenantId()).isEqualTo("autolife"));
    }

    @Test
    @DisplayName("Tenant summaries are sorted by id")
    void tenants() {
        registry.loadAll();

        assertThat(registry.tenants()).extracting(TenantSummary::tenantId).containsExactly("autolife", "bistro");
        final TenantSummary bistroSummary = registry.summary("bistro");
        assertThat(bistroSummary.chunks()).isEqualTo(2);
        assertThat(bistroSummary.documents()).isEqualTo(1);
        assertThat(bistroSummary.folder()).isEqualTo(bistro.toString());
    }

    @Test
    @DisplayName("Unknown tenants are rejected")
    void unknownTenant() {
        registry.loadAll();

        assertThat(registry.find("nope")).isEmpty();
        assertThat(registry.find(null)).isEmpty();
        assertThatThrownBy(() -> registry.require("nope"))
                .isInstanceOf(UnknownTenantException.class)
                .hasMessage("Unknown tenant: nope");
        assertThatThrownBy(() -> registry.rebuild("nope")).isInstanceOf(UnknownTenantException.class);
    }

    @Test
    @DisplayName("Rebuild picks up new documents")
    void rebuild() throws IOException {
        registry.loadAll();
        final KnowledgeIndex before = registry.require("autolife");
        Files.writeString(autolife.resolve("hours.txt"), "Opening Hours\n\nMonday to Friday, 8 to 18.");

        final KnowledgeIndex after = registry.rebuild("autolife");

        assertThat(after).isNotSameAs(before);
        assertThat(registry.require("autolife")).isSameAs(after);
        assertThat(after.size()).isEqualTo(2);
        assertThat(before.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("A failed rebuild keeps the previous index")
    void failedRebuildKeepsPreviousIndex() throws IOException {
        registry.loadAll();
        final KnowledgeIndex before = registry.require("autolife");
        Files.delete(autolife.resolve("pricing.txt"));
        Files.delete(autolife);

        assertThatThrownBy(() -> registry.rebuild("autolife")).isInstanceOf(IOException.class);
        assertThat(registry.require("autolife")).isSameAs(before);
    }

    @Test
    @DisplayName("An unreadable tenant folder fails startup")
    void loadAllFailure() {
        config.getTenants().put("ghost", root.resolve("ghost"));

        assertThatThrownBy(() -> registry.loadAll())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("ghost")
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    @DisplayName("No configured tenants leaves the registry empty")
    void noTenants() {
        final KnowledgeIndexRegistry empty =
                new KnowledgeIndexRegistry(new ApplicationConfig(), KnowledgeIndexBuilderTest.newBuilder());

        empty.loadAll();

        assertThat(empty.tenants()).isEmpty();
        assertThat(empty.find("autolife")).isEmpty();
    }
}
