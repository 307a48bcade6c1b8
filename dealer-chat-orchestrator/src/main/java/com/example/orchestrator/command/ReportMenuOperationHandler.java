package com.example.orchestrator.command;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Answers a bare report request with the list of reports that can be asked for by name.
 */
@Component
@Order(20)
public class ReportMenuOperationHandler implements OperationHandler {

    public static final String MENU = """
            📊 *MENU LAPORAN & ANALITIK*

            1. *sales summary*: ringkasan penjualan
            2. *sales metrics*: total penjualan & revenue
            3. *sales trends*: tren penjualan
            4. *customer metrics*: metrik pelanggan
            5. *operational metrics*: metrik operasional
            6. *staff performance*: kinerja staff
            7. *whatsapp analytics*: analitik WhatsApp AI
            8. *total inventory*: total stok
            9. *low stock*: stok menipis
            10. *average price*: rata-rata harga

            Tambahkan *pdf* untuk menerima dokumen, contoh: sales summary pdf""";

    @Override
    public boolean supports(ParsedCommand command) {
        return command.command() == CommandType.REPORT
                && ReportType.fromWireName(command.param(ParsedCommand.TYPE))
                        .map(type -> type == ReportType.REPORT_MENU)
                        .orElse(true);
    }

    @Override
    public OperationResult handle(ParsedCommand command, CommandContext context) {
        return OperationResult.builder()
                .success(true)
                .message(MENU)
                .followUp(true)
                .build();
    }
}
