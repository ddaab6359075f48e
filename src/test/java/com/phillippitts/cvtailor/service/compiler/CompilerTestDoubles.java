package com.phillippitts.cvtailor.service.compiler;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

/**
 * Fake processes for hermetic tool tests; nothing here spawns a real binary.
 */
final class CompilerTestDoubles {

    private CompilerTestDoubles() {}

    /**
     * @param finishAfterMillis delay before the process exits; -1 means never
     */
    record ProcessBehavior(String stdout, String stderr, int exitCode, long finishAfterMillis) {

        static ProcessBehavior exits(int exitCode, String stdout) {
            return new ProcessBehavior(stdout, "", exitCode, 0);
        }

        static ProcessBehavior fails(String stderr) {
            return new ProcessBehavior("", stderr, 1, 0);
        }

        static ProcessBehavior hangs() {
            return new ProcessBehavior("", "", 0, -1);
        }
    }

    /**
     * Side effect run when a scripted command starts, e.g. writing the PDF pdflatex would produce.
     */
    interface OnStart {
        void accept(List<String> command, Path workingDir) throws IOException;
    }

    /**
     * Answers by executable name (first command element). Unknown executables fail to start.
     */
    static final class ScriptedProcessFactory implements ProcessFactory {
        private final Map<String, ProcessBehavior> behaviors = new LinkedHashMap<>();
        private final Map<String, OnStart> sideEffects = new LinkedHashMap<>();
        private final List<List<String>> commands = new CopyOnWriteArrayList<>();
        private final List<TestProcess> started = new CopyOnWriteArrayList<>();

        ScriptedProcessFactory on(String executable, ProcessBehavior behavior) {
            behaviors.put(executable, behavior);
            return this;
        }

        ScriptedProcessFactory on(String executable, ProcessBehavior behavior, OnStart onStart) {
            sideEffects.put(executable, onStart);
            return on(executable, behavior);
        }

        @Override
        public Process start(List<String> command, Path workingDir) throws IOException {
            commands.add(new ArrayList<>(command));
            ProcessBehavior behavior = behaviors.get(command.get(0));
            if (behavior == null) {
                throw new IOException("Cannot run program \"" + command.get(0) + "\": error=2, No such file");
            }
            OnStart onStart = sideEffects.get(command.get(0));
            if (onStart != null) {
                onStart.accept(command, workingDir);
            }
            TestProcess process = new TestProcess(behavior);
            started.add(process);
            return process;
        }

        List<List<String>> commands() {
            return List.copyOf(commands);
        }

        List<TestProcess> started() {
            return List.copyOf(started);
        }
    }

    static final class TestProcess extends Process {
        private final byte[] out;
        private final byte[] err;
        private final int exitCode;
        private final long finishAfterMillis;
        private volatile boolean alive;
        private volatile boolean destroyCalled;

        TestProcess(ProcessBehavior behavior) {
            this.out = behavior.stdout().getBytes(StandardCharsets.UTF_8);
            this.err = behavior.stderr().getBytes(StandardCharsets.UTF_8);
            this.exitCode = behavior.exitCode();
            this.finishAfterMillis = behavior.finishAfterMillis();
            this.alive = finishAfterMillis != 0;
        }

        boolean wasDestroyCalled() {
            return destroyCalled;
        }

        @Override
        public OutputStream getOutputStream() {
            return new ByteArrayOutputStream();
        }

        @Override
        public InputStream getInputStream() {
            return new ByteArrayInputStream(out);
        }

        @Override
        public InputStream getErrorStream() {
            return new ByteArrayInputStream(err);
        }

        @Override
        public int waitFor() {
            alive = false;
            return exitCode;
        }

        @Override
        public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
            long ms = unit.toMillis(timeout);
            if (!alive) {
                return true;
            }
            if (finishAfterMillis < 0 || finishAfterMillis > ms) {
                Thread.sleep(ms);
                return !alive;
            }
            Thread.sleep(finishAfterMillis);
            alive = false;
            return true;
        }

        @Override
        public int exitValue() {
            if (alive) {
                throw new IllegalThreadStateException("process has not exited");
            }
            return exitCode;
        }

        @Override
        public void destroy() {
            destroyCalled = true;
            alive = false;
        }

        @Override
        public Process destroyForcibly() {
            destroy();
            return this;
        }

        @Override
        public boolean isAlive() {
            return alive;
        }
    }
}
