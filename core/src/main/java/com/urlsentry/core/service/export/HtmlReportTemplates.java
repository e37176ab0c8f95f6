package com.urlsentry.core.service.export;

final class HtmlReportTemplates {
    private HtmlReportTemplates() {}

    /** 대시보드 스타일(다크 기본, 라이트 자동) */
    static String css() {
        return """
        :root{
          --bg:#0f172a; --fg:#e5e7eb; --muted:#94a3b8;
          --card:#0b1220; --bd:#2a3343; --row:#0e1624;
          --bad:#ef4444; --warn:#f59e0b; --ok:#22c55e; --info:#60a5fa;
          --link:#60a5fa;
        }
        @media (prefers-color-scheme: light){
          :root{
            --bg:#ffffff; --fg:#0f172a; --muted:#475569;
            --card:#ffffff; --bd:#e2e8f0; --row:#f8fafc;
            --bad:#dc2626; --warn:#d97706; --ok:#16a34a; --info:#2563eb;
            --link:#2563eb;
          }
        }
        html,body{margin:0;padding:0;background:var(--bg);color:var(--fg);font:14px/1.6 system-ui,-apple-system,Segoe UI,Roboto,sans-serif}
        a{color:var(--link)}
        .muted{color:var(--muted)}
        .wrap{padding:12px 24px 48px}
        header{padding:16px 24px;border-bottom:1px solid var(--bd)}
        header h1{font-size:20px;margin:0 0 6px}
        .card{background:var(--card);border:1px solid var(--bd);border-radius:12px;padding:14px;margin:12px 0}
        .grid{display:grid;grid-template-columns:repeat(2,minmax(0,1fr));gap:8px 16px}
        @media (max-width:960px){.grid{grid-template-columns:1fr}}
        .kv .k{color:var(--muted);margin-right:8px}
        .kv .v{font-weight:700}
        .verdict{display:inline-block;padding:.2rem .8rem;border-radius:.6rem;font-weight:800;margin-bottom:10px}
        .verdict-pass{background:var(--ok);color:#0b1220}
        .verdict-fail{background:var(--bad);color:#fff}
        .kind-HTTP_ERROR,.kind-CONNECTION_ERROR,.kind-TIMEOUT{color:var(--bad);font-weight:700}
        .kind-TIMEOUT_ALLOWED{color:var(--warn)}
        .kind-SUCCESS{color:var(--ok)}
        .kind-EXCLUDED_BY_PATTERN,.kind-ALLOWED{color:var(--info)}
        table{width:100%;border-collapse:separate;border-spacing:0;border:1px solid var(--bd);border-radius:12px;overflow:hidden}
        thead th{border-bottom:1px solid var(--bd);padding:10px;text-align:left;font-weight:800}
        tbody td{padding:10px;border-bottom:1px solid var(--bd)}
        tbody tr:nth-child(even){background:var(--row)}
        .url{word-break:break-all}
        """;
    }
}
