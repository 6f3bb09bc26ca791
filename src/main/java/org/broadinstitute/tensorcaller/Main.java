package org.broadinstitute.tensorcaller;

import org.broadinstitute.barclay.argparser.CommandLineException;
import org.broadinstitute.tensorcaller.cmdline.CommandLineProgram;
import org.broadinstitute.tensorcaller.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.tensorcaller.exceptions.UserException;
import org.broadinstitute.tensorcaller.tools.CallVariantsFromTensors;
import org.broadinstitute.tensorcaller.utils.Utils;
import org.broadinstitute.tensorcaller.utils.config.ConfigFactory;

import java.io.PrintStream;

/**
 * This is the main class of the caller and is the entry point from the command line.
 *
 * The configuration file named by {@code --config-file} is loaded before the tool is built, so that configured
 * values are in place for argument defaults.
 */
public class Main {

    static {
        // Force the JVM locale into US English so that we don't have to think about number formatting issues.
        Utils.forceJVMLocaleToUSEnglish();
    }

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
    private static final String STACK_TRACE_ON_USER_EXCEPTION_PROPERTY = "TENSOR_CALLER_STACKTRACE_ON_USER_EXCEPTION";

    /**
     * Prints the given message (may be null) to the provided stream, adding adornments and formatting.
     */
    protected static void printDecoratedExceptionMessage(final PrintStream ps, final Exception e, String prefix){
        Utils.nonNull(ps, "stream");
        Utils.nonNull(e, "exception");
        ps.println("***********************************************************************");
        ps.println();
        ps.println(prefix + e.getMessage());
        ps.println();
        ps.println("***********************************************************************") ;
    }

    /**
     * Reads the configuration file option from the raw arguments and initializes the configuration.
     */
    protected void parseArgsForConfigSetup(final String[] args) {
        ConfigFactory.getInstance().initializeConfigurationsFromCommandLineArgs(args, "--" + StandardArgumentDefinitions.CONFIG_FILE_OPTION);
    }

    /**
     * @return the program to run
     */
    protected CommandLineProgram makeCommandLineProgram() {
        return new CallVariantsFromTensors();
    }

    /**
     * This method is not intended to be used outside of the caller and tests.
     */
    public Object instanceMain(final String[] args) {
        parseArgsForConfigSetup(args);
        return makeCommandLineProgram().instanceMain(args);
    }

    /**
     * This method is the main entry point for the caller. Runs the tool and maps failures to exit codes.
     */
    protected final void mainEntry(final String[] args) {
        final CommandLineProgram program = makeCommandLineProgram();
        try {
            parseArgsForConfigSetup(args);
            final Object result = program.instanceMain(args);
            handleResult(result);
            System.exit(0);
        } catch (final CommandLineException e){
            System.err.println(program.getUsage());
            handleUserException(e);
            System.exit(COMMANDLINE_EXCEPTION_EXIT_VALUE);
        } catch (final UserException e){
            handleUserException(e);
            System.exit(USER_EXCEPTION_EXIT_VALUE);
        } catch (final Exception e){
            handleNonUserException(e);
            System.exit(ANY_OTHER_EXCEPTION_EXIT_VALUE);
        }
    }

    /**
     * Handle the result returned for a tool. Default implementation logs nothing; the tool reports its own totals.
     * @param result the result of the tool (may be null)
     */
    protected void handleResult(final Object result) {}

    /**
     * Handle an exception that was likely caused by user error.
     * This includes {@link UserException} and {@link CommandLineException}
     *
     * Default implementation produces a pretty error message
     * and a stack trace iff {@link #printStackTraceOnUserExceptions()}
     *
     * @param e the exception to handle
     */
    protected void handleUserException(Exception e) {
        printDecoratedExceptionMessage(System.err, e, "A USER ERROR has occurred: ");

        if(printStackTraceOnUserExceptions()) {
            e.printStackTrace();
        } else {
            System.err.println(String.format(
                    "Set the system property %s (-D%s=true) to print the stack trace.",
                    STACK_TRACE_ON_USER_EXCEPTION_PROPERTY,
                    STACK_TRACE_ON_USER_EXCEPTION_PROPERTY));
        }
    }

    /**
     * Handle any exception that does not come from the user. Default implementation prints the stack trace.
     * @param exception the exception to handle (never an {@link UserException}).
     */
    protected void handleNonUserException(final Exception exception) {
        exception.printStackTrace();
    }

    /** The entry point to the caller from commandline. It calls {@link #mainEntry(String[])} from this instance. */
    public static void main(final String[] args) {
        new Main().mainEntry(args);
    }

    private static boolean printStackTraceOnUserExceptions() {
        return "true".equals(System.getenv(STACK_TRACE_ON_USER_EXCEPTION_PROPERTY)) || Boolean.getBoolean(STACK_TRACE_ON_USER_EXCEPTION_PROPERTY);
    }
}
