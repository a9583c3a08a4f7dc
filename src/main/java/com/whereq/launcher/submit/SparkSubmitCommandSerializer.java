package com.whereq.launcher.submit;

import com.google.common.base.Joiner;
import com.whereq.launcher.model.DependencySet;
import com.whereq.launcher.model.JobDescriptor;
import com.whereq.launcher.model.ResourceRequest;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Renders a {@link JobDescriptor} into spark-submit arguments.
 * <p>
 * The order is fixed so that the same descriptor always yields the same command:
 * master, deploy mode, name, files, py-files, packages, driver memory, executor memory,
 * driver cores, executor cores, number of executors, --conf entries sorted by key,
 * entry point, then the positional arguments. Absent optional values produce no flag.
 *
 * @author WhereQ Inc.
 */
@Component
public class SparkSubmitCommandSerializer {

    static final String MASTER = "--master";
    static final String DEPLOY_MODE = "--deploy-mode";
    static final String NAME = "--name";
    static final String FILES = "--files";
    static final String PY_FILES = "--py-files";
    static final String PACKAGES = "--packages";
    static final String DRIVER_MEMORY = "--driver-memory";
    static final String EXECUTOR_MEMORY = "--executor-memory";
    static final String DRIVER_CORES = "--driver-cores";
    static final String EXECUTOR_CORES = "--executor-cores";
    static final String NUM_EXECUTORS = "--num-executors";
    static final String CONF = "--conf";

    private static final Joiner LIST_JOINER = Joiner.on(',');
    private static final Pattern SHELL_SAFE = Pattern.compile("[A-Za-z0-9_@%+=:,./-]+");

    /**
     * Build the spark-submit argument list, without the executable itself.
     *
     * @param descriptor the job to render
     * @return arguments in submission order
     */
    public List<String> render(JobDescriptor descriptor) {
        List<String> command = new ArrayList<>();

        addOption(command, MASTER, descriptor.getMasterEndpoint().toMasterUrl());
        if (descriptor.getDeployMode() != null) {
            addOption(command, DEPLOY_MODE, descriptor.getDeployMode().getValue());
        }
        addOption(command, NAME, descriptor.getName());

        DependencySet dependencies = descriptor.getDependencies();
        addList(command, FILES, toStrings(dependencies.getDataFiles()));
        addList(command, PY_FILES, toStrings(dependencies.getCodeFiles()));
        addList(command, PACKAGES, dependencies.getRemotePackages());

        ResourceRequest resources = descriptor.getResources();
        addOption(command, DRIVER_MEMORY, resources.getDriverMemory());
        addOption(command, EXECUTOR_MEMORY, resources.getExecutorMemory());
        addOption(command, DRIVER_CORES, resources.getDriverCores());
        addOption(command, EXECUTOR_CORES, resources.getExecutorCores());
        addOption(command, NUM_EXECUTORS, resources.getNumExecutors());

        for (Map.Entry<String, String> entry : new TreeMap<>(descriptor.getSparkConf()).entrySet()) {
            command.add(CONF);
            command.add(entry.getKey() + "=" + entry.getValue());
        }

        command.add(descriptor.getEntryPoint().toString());
        command.addAll(descriptor.getArguments());

        return command;
    }

    /**
     * Render arguments as a single line a POSIX shell would split back into the same
     * arguments. Used for logging and dry runs, never for execution.
     */
    public String toShellString(List<String> arguments) {
        return arguments.stream()
                .map(SparkSubmitCommandSerializer::quote)
                .collect(Collectors.joining(" "));
    }

    static String quote(String argument) {
        if (!argument.isEmpty() && SHELL_SAFE.matcher(argument).matches()) {
            return argument;
        }
        return "'" + argument.replace("'", "'\\''") + "'";
    }

    private static void addOption(List<String> command, String flag, Object value) {
        if (value != null) {
            command.add(flag);
            command.add(value.toString());
        }
    }

    private static void addList(List<String> command, String flag, List<String> values) {
        if (!values.isEmpty()) {
            command.add(flag);
            command.add(LIST_JOINER.join(values));
        }
    }

    private static List<String> toStrings(List<Path> paths) {
        return paths.stream().map(Path::toString).collect(Collectors.toList());
    }
}
