package com.inkboard.selectionservice.viewport;

import com.inkboard.selectionservice.conflict.ConflictRecord;
import com.inkboard.selectionservice.conflict.Contender;
import com.inkboard.selectionservice.conflict.ResolutionMode;
import com.inkboard.selectionservice.geometry.BoundsCache;
import com.inkboard.selectionservice.geometry.Box;
import com.inkboard.selectionservice.geometry.CanvasTransform;
import com.inkboard.selectionservice.geometry.ElementBoundsRegistry;
import com.inkboard.selectionservice.ownership.LockReason;
import com.inkboard.selectionservice.ownership.OwnershipRecord;
import com.inkboard.selectionservice.selection.SelectionRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ViewportCullerTest {

    private ElementBoundsRegistry registry;
    private ViewportCuller culler;

    @BeforeEach
    void setUp() {
        registry = new ElementBoundsRegistry();
        culler = new ViewportCuller(new BoundsCache(), registry, 256, 0);
    }

    @Test
    void shouldKeepOnlySelectionsInsideViewport() {
        registry.update("e1", new Box(10, 10, 20, 20));
        registry.update("e2", new Box(5_000, 5_000, 20, 20));
        SelectionRecord near = selection("near", "e1");
        SelectionRecord far = selection("far", "e2");
        culler.trackSelection(near);
        culler.trackSelection(far);

        List<SelectionRecord> visible = culler.visibleSelections(List.of(near, far), Viewport.of(0, 0, 800, 600), 10);

        assertThat(visible).extracting(SelectionRecord::userId).containsExactly("near");
    }

    @Test
    void shouldExcludeElementOutsideViewportEvenWithPadding() {
        registry.update("e2", new Box(300, 300, 50, 50));
        SelectionRecord selection = selection("u", "e2");
        ViewportCuller padded = new ViewportCuller(new BoundsCache(), registry, 256, 50);
        culler.trackSelection(selection);
        padded.trackSelection(selection);
        Viewport viewport = Viewport.of(0, 0, 200, 200);

        assertThat(culler.visibleSelections(List.of(selection), viewport, 10)).isEmpty();
        assertThat(padded.visibleSelections(List.of(selection), viewport, 10)).isEmpty();
    }

    @Test
    void shouldTruncateInRenderOrder() {
        List<SelectionRecord> selections = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            String elementId = "e" + i;
            registry.update(elementId, new Box(i * 10, 0, 5, 5));
            SelectionRecord selection = selection("u" + i, elementId);
            culler.trackSelection(selection);
            selections.add(selection);
        }

        List<SelectionRecord> visible = culler.visibleSelections(selections, Viewport.of(0, 0, 1_000, 1_000), 25);

        assertThat(visible).hasSize(25);
        assertThat(visible).containsExactlyElementsOf(selections.subList(0, 25));
    }

    @Test
    void shouldExcludeSelectionsWithoutResolvableBounds() {
        SelectionRecord unknown = selection("ghost", "missing");
        culler.trackSelection(unknown);

        assertThat(culler.visibleSelections(List.of(unknown), Viewport.of(-1e5, -1e5, 2e5, 2e5), 10)).isEmpty();
    }

    @Test
    void shouldPreferExplicitBounds() {
        registry.update("e1", new Box(5_000, 5_000, 10, 10));
        SelectionRecord selection = new SelectionRecord("u", "u", "#000", "wb", null, List.of("e1"),
                new Box(100, 100, 10, 10), 1, 0, false, true, 1);
        culler.trackSelection(selection);

        assertThat(culler.visibleSelections(List.of(selection), Viewport.of(0, 0, 200, 200), 10)).hasSize(1);
    }

    @Test
    void shouldApplyTransformAndPadding() {
        ViewportCuller padded = new ViewportCuller(new BoundsCache(), registry, 256, 50);
        registry.update("e1", new Box(1_010, 0, 10, 10));
        SelectionRecord selection = selection("u", "e1");
        padded.trackSelection(selection);

        // canvas x = screen x / 2 - (-500); screen [0, 1000] covers canvas [500, 1000]
        Viewport zoomed = new Viewport(new Box(0, 0, 1_000, 1_000), new CanvasTransform(-500, 0, 2));

        assertThat(culler.visibleSelections(List.of(selection), zoomed, 10)).isEmpty();
        assertThat(padded.visibleSelections(List.of(selection), zoomed, 10)).hasSize(1);
    }

    @Test
    void shouldDropSelectionFromIndexWhenBoundsDisappear() {
        registry.update("e1", new Box(10, 10, 10, 10));
        SelectionRecord selection = selection("u", "e1");
        culler.trackSelection(selection);
        assertThat(culler.selectionIndexStats().entryCount()).isEqualTo(1);

        culler.trackSelection(selection.withElementIds(List.of()));

        assertThat(culler.selectionIndexStats().entryCount()).isZero();
    }

    @Test
    void shouldCullConflictsAndOwnershipsByElementBounds() {
        registry.update("in", new Box(10, 10, 10, 10));
        registry.update("out", new Box(9_000, 9_000, 10, 10));
        culler.trackElement("in");
        culler.trackElement("out");
        List<ConflictRecord> conflicts = List.of(conflict("in"), conflict("out"));
        List<OwnershipRecord> ownerships = List.of(ownership("out"), ownership("in"));
        Viewport viewport = Viewport.of(0, 0, 100, 100);

        assertThat(culler.visibleConflicts(conflicts, viewport, 10))
                .extracting(ConflictRecord::elementId).containsExactly("in");
        assertThat(culler.visibleOwnerships(ownerships, viewport, 10))
                .extracting(OwnershipRecord::elementId).containsExactly("in");
    }

    @Test
    void shouldRenderHintsForCurrentUserAndConflicts() {
        registry.update("e1", new Box(0, 0, 10, 10));
        registry.update("e2", new Box(20, 0, 10, 10));
        SelectionRecord mine = selection("me", "e1");
        SelectionRecord theirs = selection("them", "e2");
        SelectionRecord rival = selection("rival", "e2");
        List<SelectionRecord> selections = List.of(mine, theirs, rival);
        selections.forEach(culler::trackSelection);
        culler.trackElement("e2");

        VisibleState state = culler.render(selections, List.of(conflict("e2")), List.of(),
                Viewport.of(0, 0, 100, 100), "me", PerformanceMode.HIGH, 25);

        assertThat(state.selections()).extracting(SelectionHighlight::userId).containsExactly("me", "them", "rival");
        assertThat(state.selections().get(0).hints())
                .isEqualTo(new HighlightHints(0.4, HighlightHints.Style.SOLID, HighlightHints.Animation.NONE));
        assertThat(state.selections().get(1).hints())
                .isEqualTo(new HighlightHints(0.5, HighlightHints.Style.DASHED, HighlightHints.Animation.PULSE));
        assertThat(state.selections().get(0).bounds()).isEqualTo(new Box(0, 0, 10, 10));
        assertThat(state.conflicts()).hasSize(1);
        assertThat(state.stats()).isEqualTo(new VisibleState.Stats(3, 3, 1, 0, PerformanceMode.HIGH));
    }

    @Test
    void shouldCapSelectionsByPerformanceMode() {
        List<SelectionRecord> selections = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            registry.update("e" + i, new Box(i, i, 1, 1));
            SelectionRecord selection = selection("u" + i, "e" + i);
            culler.trackSelection(selection);
            selections.add(selection);
        }

        VisibleState low = culler.render(selections, List.of(), List.of(),
                Viewport.of(0, 0, 100, 100), null, PerformanceMode.LOW, 25);
        VisibleState balanced = culler.render(selections, List.of(), List.of(),
                Viewport.of(0, 0, 100, 100), null, PerformanceMode.BALANCED, 25);

        assertThat(low.selections()).hasSize(10);
        assertThat(balanced.selections()).hasSize(15);
        assertThat(low.stats().totalSelections()).isEqualTo(20);
    }

    private static SelectionRecord selection(String userId, String... elementIds) {
        return new SelectionRecord(userId, userId, "#00ff00", "wb", null, List.of(elementIds),
                null, 1, 0, false, true, 1);
    }

    private static ConflictRecord conflict(String elementId) {
        return new ConflictRecord(ConflictRecord.idFor(elementId), elementId,
                List.of(new Contender("a", "a", 0, 1), new Contender("b", "b", 0, 2)), ResolutionMode.MANUAL);
    }

    private static OwnershipRecord ownership(String elementId) {
        return new OwnershipRecord(elementId, "a", "a", 0, 10_000, true, LockReason.EDITING, 0);
    }
}
