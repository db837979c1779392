package docbro.shelf;

import docbro.MutableClock;
import docbro.config.RegistryConfig;
import docbro.db.SqliteDatabase;
import docbro.db.migration.DatabaseMigrator;
import docbro.db.migration.registry.V3_DefaultShelf;
import docbro.errors.AlreadyExistsException;
import docbro.errors.NotFoundException;
import docbro.errors.ValidationException;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class ShelfRepositoryTest {

    @TempDir
    Path tempDir;

    private SqliteDatabase database;
    private ShelfRepository shelves;

    @BeforeEach
    void setUp() {
        RegistryConfig config = RegistryConfig.builder().dataDirectory(tempDir).build();
        database = SqliteDatabase.open(config.getRegistryFile(), config);
        DatabaseMigrator.forRegistry(database).migrateToLatest();
        shelves = new ShelfRepository(database, MutableClock.startingAt("2025-01-01T00:00:00Z"));
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    @Test
    void seededDefaultShelfHoldsTheDefaultBox() {
        Shelf shelf = shelves.getDefaultShelf();

        assertThat(shelf.getName()).isEqualTo(V3_DefaultShelf.DEFAULT_SHELF_NAME);
        assertThat(shelf.isDefault()).isTrue();
        assertThat(shelf.isDeletable()).isFalse();
        assertThat(shelves.listBoxes(shelf.getId())).singleElement().satisfies(box -> {
            assertThat(box.getName()).isEqualTo(V3_DefaultShelf.DEFAULT_BOX_NAME);
            assertThat(box.getType()).isEqualTo(BoxType.BAG);
            assertThat(box.isDeletable()).isFalse();
            assertThat(box.getPosition()).isEqualTo(1);
        });
    }

    @Test
    void defaultRowsCannotBeDeleted() {
        Shelf shelf = shelves.getDefaultShelf();
        Box box = shelves.findBoxByName(V3_DefaultShelf.DEFAULT_BOX_NAME).orElseThrow();

        assertThatThrownBy(() -> shelves.deleteShelf(shelf.getId()))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Shelf 'common shelf' cannot be deleted");
        assertThatThrownBy(() -> shelves.deleteBox(box.getId()))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Box 'new year' cannot be deleted");
        assertThat(shelves.listShelves()).hasSize(1);
    }

    @Test
    void boxesAreAppendedInPositionOrder() {
        Shelf shelf = shelves.createShelf("  research ");
        assertThat(shelf.getName()).isEqualTo("research");
        assertThat(shelf.isDefault()).isFalse();

        shelves.createBox("crawler", BoxType.DRAG, shelf.getId());
        shelves.createBox("notes", BoxType.RAG, shelf.getId());

        assertThat(shelves.listBoxes(shelf.getId()))
                .extracting(Box::getName, Box::getPosition)
                .containsExactly(
                        tuple("crawler", 1),
                        tuple("notes", 2));
        assertThat(shelves.findBoxByName("notes").orElseThrow().getPosition()).isNull();
        assertThat(shelves.listShelves()).extracting(Shelf::getName)
                .containsExactly(V3_DefaultShelf.DEFAULT_SHELF_NAME, "research");
    }

    @Test
    void duplicateNamesAndMissingShelvesAreRejected() {
        Shelf shelf = shelves.createShelf("research");

        assertThatThrownBy(() -> shelves.createShelf("research"))
                .isInstanceOf(AlreadyExistsException.class)
                .hasMessage("Shelf 'research' already exists");
        assertThatThrownBy(() -> shelves.createBox("new year", BoxType.BAG, shelf.getId()))
                .isInstanceOf(AlreadyExistsException.class);
        assertThatThrownBy(() -> shelves.createBox("orphan", BoxType.BAG, "missing"))
                .isInstanceOf(NotFoundException.class);
        assertThat(shelves.findBoxByName("orphan")).isEmpty();
        assertThatThrownBy(() -> shelves.createShelf(" ")).isInstanceOf(ValidationException.class);
    }

    @Test
    void deletingAShelfDropsItsLinks() {
        Shelf shelf = shelves.createShelf("research");
        Box box = shelves.createBox("notes", BoxType.RAG, shelf.getId());

        assertThat(shelves.deleteShelf(shelf.getId())).isTrue();

        assertThat(shelves.findShelfByName("research")).isEmpty();
        assertThat(shelves.listBoxes(shelf.getId())).isEmpty();
        assertThat(shelves.deleteBox(box.getId())).isTrue();
        assertThat(shelves.deleteBox(box.getId())).isFalse();
    }
}
