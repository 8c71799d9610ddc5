package org.broadinstitute.fusionworkbook;

import org.broadinstitute.barclay.argparser.CommandLineException;
import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.fusionworkbook.cmdline.CommandLineProgram;
import org.broadinstitute.fusionworkbook.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.fusionworkbook.exceptions.UserException;
import org.broadinstitute.fusionworkbook.tools.GenerateFusionWorkbook;
import org.broadinstitute.fusionworkbook.utils.Utils;
import org.broadinstitute.fusionworkbook.utils.config.ConfigFactory;

import java.io.PrintStream;
import java.lang.reflect.InvocationTargetException;
import java.util.*;

/**
 * Entry point of fusion-workbook: the first argument names the program to run, the rest are its arguments.
 */
public final class Main {

    static {
        // Reports are read by people and scripts that expect US number formatting.
        Utils.forceJVMLocaleToUSEnglish();
    }

    private static final String COMMAND_LINE_NAME = "fusion-workbook";

    /**
     * exit value when an issue with the commandline is detected, ie CommandLineException.
     */
    private static final int COMMANDLINE_EXCEPTION_EXIT_VALUE = 1;

    /**
     * Exit value when an unrecoverable {@link UserException} occurs.
     */
    public static final int USER_EXCEPTION_EXIT_VALUE = 2;

    /**
     * exit value when any unrecoverable exception other than {@link UserException} occurs
     */
    private static final int ANY_OTHER_EXCEPTION_EXIT_VALUE = 3;
    private static final String STACK_TRACE_ON_USER_EXCEPTION_PROPERTY = "FUSION_WORKBOOK_STACKTRACE_ON_USER_EXCEPTION";

    /**
     * The command line programs that can be run.
     */
    List<Class<? extends CommandLineProgram>> getClassList() {
        return Collections.singletonList(GenerateFusionWorkbook.class);
    }

    /**
     * Runs the program named by the first argument with the remaining ones.
     *
     * @return the result of the program, {@code null} if only the usage was requested.
     */
    public Object instanceMain(final String[] args) {
        final CommandLineProgram program = setupConfigAndExtractProgram(args);
        return runCommandLineProgram(program, args);
    }

    private static Object runCommandLineProgram(final CommandLineProgram program, final String[] rawArgs) {
        if (null == program) return null; // only the usage was requested
        final String[] mainArgs = Arrays.copyOfRange(rawArgs, 1, rawArgs.length);
        return program.instanceMain(mainArgs);
    }

    /**
     * Initializes the configuration before any tool is created, so that argument defaults taken from the
     * configuration see it, then creates the program to run.
     */
    private CommandLineProgram setupConfigAndExtractProgram(final String[] args) {
        ConfigFactory.getInstance().initializeConfigurationFromCommandLineArgs(args, "--" + StandardArgumentDefinitions.CONFIG_FILE_OPTION);
        return extractCommandLineProgram(args);
    }

    /**
     * Runs the program and exits with a value that tells user errors from other failures.
     *
     * Note: this is the only method that is allowed to call System.exit (because tools may be run from test harness etc)
     */
    private void mainEntry(final String[] args) {
        CommandLineProgram program = null;
        try {
            program = setupConfigAndExtractProgram(args);
            final Object result = runCommandLineProgram(program, args);
            if (result != null) {
                System.out.println("Tool returned:\n" + result);
            }
        } catch (final CommandLineException e){
            if (program != null) {
                System.err.println(program.getUsage());
            }
            handleUserException(e);
            System.exit(COMMANDLINE_EXCEPTION_EXIT_VALUE);
        } catch (final UserException e){
            handleUserException(e);
            System.exit(USER_EXCEPTION_EXIT_VALUE);
        } catch (final Exception e){
            e.printStackTrace();
            System.exit(ANY_OTHER_EXCEPTION_EXIT_VALUE);
        }
    }

    private static void handleUserException(final Exception e) {
        System.err.println("***********************************************************************");
        System.err.println();
        System.err.println("A USER ERROR has occurred: " + e.getMessage());
        System.err.println();
        System.err.println("***********************************************************************");

        if (printStackTraceOnUserExceptions()) {
            e.printStackTrace();
        } else {
            System.err.println(String.format(
                    "Set the system property %s (-D%s=true) to print the stack trace.",
                    STACK_TRACE_ON_USER_EXCEPTION_PROPERTY,
                    STACK_TRACE_ON_USER_EXCEPTION_PROPERTY));
        }
    }

    public static void main(final String[] args) {
        new Main().mainEntry(args);
    }

    private static boolean printStackTraceOnUserExceptions() {
        return "true".equals(System.getenv(STACK_TRACE_ON_USER_EXCEPTION_PROPERTY)) || Boolean.getBoolean(STACK_TRACE_ON_USER_EXCEPTION_PROPERTY);
    }

    /**
     * Returns the command line program specified, or prints the usage and returns null if none was.
     *
     * @throws UserException if the first argument names no known program.
     */
    private CommandLineProgram extractCommandLineProgram(final String[] args) {
        final Map<String, Class<? extends CommandLineProgram>> simpleNameToClass = new LinkedHashMap<>();
        for (final Class<? extends CommandLineProgram> clazz : getClassList()) {
            if (getProgramProperty(clazz) == null) {
                throw new RuntimeException(String.format("The class '%s' is missing the required CommandLineProgramProperties annotation.", clazz.getSimpleName()));
            }
            simpleNameToClass.put(clazz.getSimpleName(), clazz);
        }

        if (args.length < 1 || args[0].equals("-h") || args[0].equals("--help")) {
            printUsage(System.out, simpleNameToClass.values());
            return null;
        }
        final Class<? extends CommandLineProgram> clazz = simpleNameToClass.get(args[0]);
        if (clazz == null) {
            printUsage(System.err, simpleNameToClass.values());
            throw new UserException(String.format("'%s' is not a valid command.", args[0]));
        }
        try {
            return clazz.getDeclaredConstructor().newInstance();
        } catch (final InstantiationException | IllegalAccessException | NoSuchMethodException | InvocationTargetException e) {
            throw new RuntimeException(e);
        }
    }

    public static CommandLineProgramProperties getProgramProperty(Class<?> clazz) {
        return clazz.getAnnotation(CommandLineProgramProperties.class);
    }

    private static void printUsage(final PrintStream destinationStream, final Collection<Class<? extends CommandLineProgram>> classes) {
        final StringBuilder builder = new StringBuilder();
        builder.append("USAGE: ").append(COMMAND_LINE_NAME).append(" <program name> [-h]\n\n")
                .append("Available Programs:\n");
        for (final Class<?> clazz : classes) {
            final CommandLineProgramProperties property = getProgramProperty(clazz);
            final CommandLineProgramGroup programGroup;
            try {
                programGroup = property.programGroup().getDeclaredConstructor().newInstance();
            } catch (final InstantiationException | IllegalAccessException | NoSuchMethodException | InvocationTargetException e) {
                throw new RuntimeException(e);
            }
            builder.append("--------------------------------------------------------------------------------------\n");
            builder.append(String.format("%-48s %-45s\n", programGroup.getName() + ":", programGroup.getDescription()));
            builder.append(String.format("    %-45s%s\n\n", clazz.getSimpleName(), property.oneLineSummary()));
        }
        builder.append("--------------------------------------------------------------------------------------\n");
        destinationStream.println(builder.toString());
    }
}
