package com.testplatform.client;

/**
 * Launches test host processes on behalf of the client, e.g. under a debugger.
 */
public interface TestHostLauncher {

    /**
     * True if hosts are launched for debugging.
     */
    boolean isDebug();

    /**
     * Launch a test host.
     *
     * @param fileName  Executable to start
     * @param arguments Command line arguments
     * @return Process id of the started host
     */
    int launchTestHost(String fileName, String arguments);
}
