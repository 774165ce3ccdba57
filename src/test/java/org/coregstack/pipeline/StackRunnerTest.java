package org.coregstack.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import org.coregstack.coreg.CoregistrationSettings;
import org.coregstack.scheduler.RunReport;
import org.coregstack.scheduler.RunReport.NodeState;
import org.coregstack.scheduler.SchedulerSettings;
import org.coregstack.scheduler.StructuralException;
import org.coregstack.scheduler.TaskStatus;
import org.coregstack.stack.AcquisitionDate;
import org.coregstack.stack.DatePair;
import org.coregstack.stack.ListFiles;
import org.coregstack.stack.StackPaths;
import org.coregstack.stack.StackSettings;
import org.coregstack.tree.TreeSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@Tag("integration")
class StackRunnerTest {

    private static final AcquisitionDate FIRST = AcquisitionDate.of(2020, 1, 1);
    private static final AcquisitionDate MIDDLE = AcquisitionDate.of(2020, 1, 13);
    private static final AcquisitionDate LAST = AcquisitionDate.of(2020, 1, 25);
    private static final List<AcquisitionDate> DATES = List.of(FIRST, MIDDLE, LAST);

    @TempDir
    Path tempDir;

    private Path scenesList;
    private StackFixture.AlignedToolkit toolkit;

    @BeforeEach
    void setUp() {
        scenesList = tempDir.resolve("scenes.list");
        toolkit = new StackFixture.AlignedToolkit();
    }

    private StackSettings stackSettings(AcquisitionDate reference) {
        return new StackSettings("s1", tempDir.resolve("out"), tempDir.resolve("status"), scenesList,
                Optional.ofNullable(reference), StackFixture.POLARISATION, StackFixture.RANGE_LOOKS, 1, 2, 365);
    }

    private StackRunner runner(AcquisitionDate reference, TreeSettings tree) {
        return new StackRunner(stackSettings(reference), tree, CoregistrationSettings.defaults(),
                new SchedulerSettings(2, true), directory -> toolkit);
    }

    private StackRunner writeStack(List<AcquisitionDate> dates) throws IOException {
        StackRunner runner = runner(null, TreeSettings.defaults());
        StackFixture.writeStack(runner.paths(), scenesList, MIDDLE, dates);
        return runner;
    }

    // ==== Definition ====

    @Test
    void define_writesTierAndInterferogramLists() throws IOException {
        StackRunner runner = writeStack(DATES);

        StackDefinition definition = runner.define();

        StackPaths paths = runner.paths();
        assertThat(definition.reference()).isEqualTo(MIDDLE);
        assertThat(ListFiles.readDates(paths.tierList(1))).containsExactly(FIRST, LAST);
        assertThat(paths.tierList(2)).doesNotExist();
        assertThat(ListFiles.readPairs(paths.interferogramList())).containsExactly(
                new DatePair(FIRST, MIDDLE), new DatePair(FIRST, LAST), new DatePair(MIDDLE, LAST));
    }

    @Test
    void define_rejectsReferenceOutsideScenesList() throws IOException {
        writeStack(DATES);
        StackRunner runner = runner(AcquisitionDate.of(2020, 2, 6), TreeSettings.defaults());

        assertThatThrownBy(runner::define)
                .isInstanceOf(StructuralException.class)
                .hasMessageContaining("20200206");
    }

    @Test
    void define_rejectsMissingScenesList() {
        StackRunner runner = runner(null, TreeSettings.defaults());

        assertThatThrownBy(runner::define)
                .isInstanceOf(StructuralException.class)
                .hasMessageContaining("Scenes list not found");
    }

    @Test
    void define_failsOnUnreachableDates() throws IOException {
        AcquisitionDate distant = AcquisitionDate.of(2020, 9, 1);
        writeStack(List.of(FIRST, MIDDLE, LAST, distant));
        StackRunner runner = runner(MIDDLE, new TreeSettings(63, false, true));

        assertThatThrownBy(runner::define)
                .isInstanceOf(StructuralException.class)
                .hasMessageContaining("unreachable")
                .hasMessageContaining("20200901");
    }

    @Test
    void define_dropsUnreachableDatesWhenAllowed() throws IOException {
        AcquisitionDate distant = AcquisitionDate.of(2020, 9, 1);
        writeStack(List.of(FIRST, MIDDLE, LAST, distant));
        StackRunner runner = runner(MIDDLE, new TreeSettings(63, false, false));

        StackDefinition definition = runner.define();

        assertThat(definition.forest().unreachable()).containsExactly(distant);
        assertThat(definition.interferograms()).noneMatch(pair -> pair.secondary().equals(distant));
    }

    // ==== Runs ====

    @Test
    void run_processesWholeStack() throws IOException {
        StackRunner runner = writeStack(DATES);

        RunReport report = runner.run();

        assertThat(report.hasFailures()).isFalse();
        assertThat(report.count(NodeState.SUCCEEDED)).isEqualTo(3 + 2 + 3);
        StackPaths paths = runner.paths();
        for (AcquisitionDate date : List.of(FIRST, LAST)) {
            assertThat(paths.resampledSlc(date)).exists();
            assertThat(paths.resampledMli(date)).exists();
            assertThat(paths.sceneDirectory(date).resolve(paths.pairName(MIDDLE, date) + "_scratch")).doesNotExist();
        }
        assertThat(paths.interferogram(new DatePair(FIRST, LAST))).exists();
        assertThat(tempDir.resolve("status/s1_run_summary.out")).exists();
        assertThat(runner.markers().read(StackPlanner.coregistrationId(LAST))).isEqualTo(TaskStatus.SUCCEEDED);
    }

    @Test
    void resume_afterCompleteRunDoesNothing() throws IOException {
        StackRunner runner = writeStack(DATES);
        runner.run();
        int calls = toolkit.calls();

        RunReport report = runner.resume();

        assertThat(report.count(NodeState.SKIPPED)).isEqualTo(8);
        assertThat(toolkit.calls()).isEqualTo(calls);
    }

    @Test
    void run_isolatesFailedDateAndResumeCompletesIt() throws IOException {
        StackRunner runner = writeStack(DATES);
        toolkit.failMultiLook(runner.paths().slc(LAST));

        RunReport failed = runner.run();

        assertThat(failed.hasFailures()).isTrue();
        assertThat(failed.state(StackPlanner.multilookId(LAST))).isEqualTo(NodeState.FAILED);
        assertThat(failed.state(StackPlanner.coregistrationId(LAST))).isEqualTo(NodeState.BLOCKED);
        assertThat(failed.state(StackPlanner.interferogramId(new DatePair(MIDDLE, LAST))))
                .isEqualTo(NodeState.BLOCKED);
        assertThat(failed.state(StackPlanner.coregistrationId(FIRST))).isEqualTo(NodeState.SUCCEEDED);
        assertThat(failed.state(StackPlanner.interferogramId(new DatePair(FIRST, MIDDLE))))
                .isEqualTo(NodeState.SUCCEEDED);

        toolkit.repair();
        RunReport resumed = runner.resume();

        assertThat(resumed.hasFailures()).isFalse();
        assertThat(resumed.idsWith(NodeState.SUCCEEDED)).containsExactlyInAnyOrder(
                StackPlanner.multilookId(LAST),
                StackPlanner.coregistrationId(LAST),
                StackPlanner.interferogramId(new DatePair(FIRST, LAST)),
                StackPlanner.interferogramId(new DatePair(MIDDLE, LAST)));
        assertThat(Files.readString(tempDir.resolve("status/s1_run_summary.out")))
                .startsWith("Stack s1: 4 succeeded, 0 degraded, 0 failed, 0 blocked, 4 skipped");
    }
}
