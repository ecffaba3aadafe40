/**
 * JSON batch reports written with Jackson.
 *
 * @see fr.lapetina.imagebatch.report.ReportWriter
 * @see fr.lapetina.imagebatch.report.dto.BatchReportDocument
 */
package fr.lapetina.imagebatch.report;
