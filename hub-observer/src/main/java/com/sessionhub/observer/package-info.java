/**
 * 观察端客户端：维护到会话中心的长连接，按退避策略重连，并在本地合并会话快照与增量。
 */
package com.sessionhub.observer;
