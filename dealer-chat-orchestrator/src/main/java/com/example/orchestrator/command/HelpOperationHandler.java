package com.example.orchestrator.command;

import com.example.orchestrator.domain.StaffRole;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(10)
public class HelpOperationHandler implements OperationHandler {

    static final String OPERATIONAL_GUIDE = """
            📋 *PANDUAN STAFF*

            📸 *UPLOAD*: ketik *upload* lalu ikuti langkahnya, atau "upload [nama] [tahun] [harga]"
            📋 *CEK STOK*: *stok* [filter], contoh "stok ready", "stok brio"
            🔄 *UPDATE STATUS*: *status [ID] [SOLD/BOOKED/AVAILABLE]*, contoh "status PM-PST-001 SOLD"
            🚙 *EDIT DATA*: *edit [ID] [field] [nilai]*, contoh "edit PM-PST-001 harga 150jt"
            📈 *STATISTIK*: *stats* [today/week/month]""";

    static final String REPORT_GUIDE =
            "\n\n👮 *ADMIN*: ketik \"report\" untuk menu laporan, atau langsung \"sales summary\", \"staff performance\"";

    static final String BASIC_GUIDE = """
            Nomor ini belum terdaftar sebagai staff.
            Jika Anda staff showroom, kirim: /verify 08xxxxxxxxxx""";

    @Override
    public boolean supports(ParsedCommand command) {
        return command.command() == CommandType.HELP;
    }

    @Override
    public OperationResult handle(ParsedCommand command, CommandContext context) {
        String message;
        if (context.roleLevel() >= StaffRole.REPORT_LEVEL) {
            message = OPERATIONAL_GUIDE + REPORT_GUIDE;
        } else if (context.roleLevel() >= StaffRole.OPERATIONAL_LEVEL) {
            message = OPERATIONAL_GUIDE;
        } else {
            message = BASIC_GUIDE;
        }
        return OperationResult.builder()
                .success(true)
                .message(message)
                .followUp(true)
                .build();
    }
}
