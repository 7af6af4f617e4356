package ippnotify.server.printer;

/**
 * Resolves the printers and jobs that requests name. Subscriptions keep only the identities returned here.
 */
public interface PrinterDirectory {

    /**
     * @return the printer, or null when none has the name
     */
    Printer findPrinter(String name);

    /**
     * @return the printer, or null when none has the id
     */
    Printer findPrinter(int printerId);

    /**
     * @return the job, or null when the printer has no job with the id
     */
    Job findJob(int printerId, int jobId);
}
