package org.frugal.ls.features;

import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextEdit;
import org.eclipse.lsp4j.WorkspaceEdit;
import org.frugal.ls.api.RenameException;
import org.frugal.ls.document.Document;
import org.frugal.ls.junit.extensions.logging.LogWatchExtension;
import org.frugal.ls.util.Ranges;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.frugal.ls.test.utils.TestDocuments.frugal;
import static org.frugal.ls.test.utils.TestDocuments.positionOf;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class RenameProviderTest {

    private static final String SOURCE = """
            struct User {
              1: string name
            }
            service UserService {
              User getUser(1: i64 id)
            }
            """;

    private final RenameProvider provider = new RenameProvider();

    /**
     * Renaming a struct edits its declaration and every use, grouped by document.
     */
    @Test
    void renamesEveryOccurrenceAcrossDocuments() throws RenameException {
        // Arrange
        Document origin = frugal("file:///a.frugal", SOURCE);
        Document other = frugal("file:///b.frugal", "struct Wrapper { 1: User user }");

        // Act
        WorkspaceEdit edit = provider.rename(origin, new Position(0, 7), "Account",
                Map.of(other.uri(), other));

        // Assert
        assertThat(edit.getChanges()).containsOnlyKeys("file:///a.frugal", "file:///b.frugal");
        assertThat(edit.getChanges().get("file:///a.frugal")).containsExactly(
                new TextEdit(Ranges.of(0, 7, 0, 11), "Account"),
                new TextEdit(Ranges.of(4, 2, 4, 6), "Account"));
        assertThat(edit.getChanges().get("file:///b.frugal")).containsExactly(
                new TextEdit(Ranges.of(0, 20, 0, 24), "Account"));
    }

    @Test
    void prepareRenameReturnsRangeOfTheName() throws RenameException {
        Document document = frugal(SOURCE);

        Optional<Range> range = provider.prepareRename(document, positionOf(SOURCE, "getUser"));

        assertThat(range).contains(Ranges.of(4, 7, 4, 14));
    }

    @Test
    void prepareRenameIsEmptyWithoutTree() throws RenameException {
        Document notes = Document.parse("file:///notes.txt", SOURCE);

        assertThat(provider.prepareRename(notes, new Position(0, 7))).isEmpty();
    }

    @Test
    void refusesBuiltinTypes() {
        Document document = frugal(SOURCE);

        assertThatThrownBy(() -> provider.prepareRename(document, positionOf(SOURCE, "string")))
                .isInstanceOf(RenameException.class)
                .hasMessage("symbol string cannot be renamed");
    }

    @Test
    void refusesPositionsWithoutSymbol() {
        Document document = frugal(SOURCE);

        assertThatThrownBy(() -> provider.rename(document, new Position(0, 0), "Other", Map.of()))
                .isInstanceOf(RenameException.class)
                .hasMessage("no renameable symbol found at position");
    }

    @Test
    void refusesTheCurrentName() {
        Document document = frugal(SOURCE);

        assertThatThrownBy(() -> provider.rename(document, new Position(0, 7), "User", Map.of()))
                .isInstanceOf(RenameException.class)
                .hasMessage("new name 'User' is the same as current name");
    }

    @Test
    void validatesNewNames() {
        assertThatThrownBy(() -> provider.validateNewName(" "))
                .hasMessage("new name cannot be empty");
        assertThatThrownBy(() -> provider.validateNewName("1abc"))
                .hasMessage("'1abc' is not a valid identifier");
        assertThatThrownBy(() -> provider.validateNewName("a.b"))
                .hasMessage("'a.b' is not a valid identifier");
        assertThatCode(() -> provider.validateNewName("_Account2")).doesNotThrowAnyException();
    }

    @ParameterizedTest
    @ValueSource(strings = {"a b", "User Name", "\u00dcn\u00efcode", "na\u00efve", "a-b", "tab\tname"})
    void rejectsNamesThatAreNotPlainIdentifiers(String name) {
        assertThatThrownBy(() -> provider.validateNewName(name))
                .isInstanceOf(RenameException.class)
                .hasMessage("'" + name + "' is not a valid identifier");
    }

    @ParameterizedTest
    @ValueSource(strings = {"struct", "service", "void", "oneway", "i64", "uuid", "map"})
    void rejectsReservedWords(String word) {
        assertThatThrownBy(() -> provider.validateNewName(word))
                .isInstanceOf(RenameException.class)
                .hasMessage("'" + word + "' is a reserved keyword and cannot be used as an identifier");
    }

    /**
     * An invalid name is rejected before any reference search is started.
     */
    @Test
    void doesNotSearchReferencesForInvalidName() {
        // Arrange
        Document document = frugal(SOURCE);
        IReferencesProvider references = mock(IReferencesProvider.class);
        when(references.symbolAt(any(), any())).thenReturn(new ReferencesProvider().symbolAt(document, new Position(0, 7)));
        RenameProvider renamer = new RenameProvider(references);

        // Act & Assert
        assertThatThrownBy(() -> renamer.rename(document, new Position(0, 7), "enum", Map.of()))
                .isInstanceOf(RenameException.class);
        verify(references, never()).findReferences(any(), any(), anyBoolean(), any());
    }
}
